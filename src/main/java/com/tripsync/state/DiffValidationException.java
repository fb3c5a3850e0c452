package com.tripsync.state;

/**
 * A proposed diff does not have the shape of a state diff, or would break a state invariant.
 * Canonical state is never touched when this is raised.
 */
public class DiffValidationException extends StateException {

    public DiffValidationException(String message) {
        super(message);
    }

    public DiffValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
