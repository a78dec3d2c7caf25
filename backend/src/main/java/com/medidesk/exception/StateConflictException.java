package com.medidesk.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The request is well formed but invalid for the current state of an entity,
 * e.g. admitting into an occupied bed or discharging a discharged admission.
 * Not retried by the engine.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class StateConflictException extends RuntimeException {

    public StateConflictException(String message) {
        super(message);
    }

    public StateConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
