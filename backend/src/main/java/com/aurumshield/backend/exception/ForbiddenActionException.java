package com.aurumshield.backend.exception;

/**
 * The actor's role may not perform the requested governance action.
 */
public class ForbiddenActionException extends RuntimeException {
    public ForbiddenActionException(String message) {
        super(message);
    }
}
