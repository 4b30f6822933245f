package com.infergate.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures the gateway reports to clients.
 * Each subclass knows the HTTP status it surfaces as.
 */
public abstract class InferenceException extends RuntimeException {

    private static final long serialVersionUID = 4415632879124117409L;

    protected InferenceException(String message) {
        super(message);
    }

    protected InferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();

    /**
     * Message safe to put in the error envelope.
     */
    public String getClientMessage() {
        return getMessage();
    }
}
