package com.tripsync.state;

/**
 * Base type for failures raised while proposing, merging or committing session state.
 */
public abstract class StateException extends RuntimeException {

    protected StateException(String message) {
        super(message);
    }

    protected StateException(String message, Throwable cause) {
        super(message, cause);
    }
}
