package com.infergate.exception;

import org.springframework.http.HttpStatus;

/**
 * Transport-level failure reaching the backend: connection refused, reset or timed out.
 */
public class BackendUnavailableException extends InferenceException {

    private static final long serialVersionUID = 2093183745529412862L;

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @Override
    public String getClientMessage() {
        return "Backend unavailable";
    }
}
