package com.infergate.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Backend was reachable but answered with a non-2xx status.
 */
@Getter
public class BackendErrorException extends InferenceException {

    private static final long serialVersionUID = -1859244725364018512L;

    private final int backendStatus;

    public BackendErrorException(int backendStatus, String message) {
        super(message);
        this.backendStatus = backendStatus;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
