package com.cloud.emulator.service;

import java.util.Objects;

/**
 * Failure of an emulated API call, carrying the provider error code and HTTP status
 * the caller should see.
 */
public class ServiceException extends RuntimeException {

    private final String errorCode;
    private final int statusCode;

    public ServiceException(int statusCode, String errorCode, String message) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode is required");
    }

    public ServiceException(int statusCode, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode is required");
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return "ServiceException{" +
                "statusCode=" + statusCode +
                ", errorCode='" + errorCode + '\'' +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
