package com.infergate.exception;

import org.springframework.http.HttpStatus;

/**
 * Well-formed request that violates a conversation invariant. Never reaches the backend.
 */
public class InvalidRequestException extends InferenceException {

    private static final long serialVersionUID = -6730984417301659873L;

    public InvalidRequestException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }
}
