package com.tripsync.api;

import com.tripsync.orchestration.OrchestrationException;
import com.tripsync.orchestration.api.AgentException;
import com.tripsync.state.CommitContentionException;
import com.tripsync.state.DiffValidationException;
import com.tripsync.state.StateException;
import com.tripsync.state.StatePersistenceException;
import com.tripsync.store.SessionStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps orchestration and state failures to HTTP responses with a {@link ErrorResponse} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<ErrorResponse> handleOrchestration(OrchestrationException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        HttpStatus status = statusFor(cause);
        String stage = e.getStage() != null ? e.getStage().name() : null;
        if (status.is5xxServerError()) {
            log.error("Request for session {} failed at {}", e.getSessionId(), stage, e);
        }
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode(cause), stage, cause.getMessage()));
    }

    @ExceptionHandler(StateException.class)
    public ResponseEntity<ErrorResponse> handleState(StateException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("State operation failed", e);
        }
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode(e), null, e.getMessage()));
    }

    @ExceptionHandler(SessionStoreException.class)
    public ResponseEntity<ErrorResponse> handleStore(SessionStoreException e) {
        log.error("Session store failure", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(errorCode(e), null, e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(new ErrorResponse("VALIDATION_ERROR", null, message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_ARGUMENT", null, e.getMessage()));
    }

    static HttpStatus statusFor(Throwable cause) {
        if (cause instanceof DiffValidationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (cause instanceof CommitContentionException) {
            return HttpStatus.CONFLICT;
        }
        if (cause instanceof StatePersistenceException || cause instanceof SessionStoreException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (cause instanceof AgentException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static String errorCode(Throwable cause) {
        if (cause instanceof DiffValidationException) {
            return "INVALID_DIFF";
        }
        if (cause instanceof CommitContentionException) {
            return "COMMIT_CONTENTION";
        }
        if (cause instanceof StatePersistenceException || cause instanceof SessionStoreException) {
            return "PERSISTENCE_ERROR";
        }
        if (cause instanceof AgentException) {
            return "AGENT_ERROR";
        }
        return "INTERNAL_ERROR";
    }
}
