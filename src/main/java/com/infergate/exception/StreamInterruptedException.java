package com.infergate.exception;

import org.springframework.http.HttpStatus;

/**
 * Backend stream ended abnormally before its terminal fragment.
 */
public class StreamInterruptedException extends InferenceException {

    private static final long serialVersionUID = 7712301987457301152L;

    public StreamInterruptedException(String message) {
        super(message);
    }

    public StreamInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @Override
    public String getClientMessage() {
        return "Backend stream interrupted";
    }
}
