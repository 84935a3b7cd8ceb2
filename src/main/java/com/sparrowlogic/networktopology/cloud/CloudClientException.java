package com.sparrowlogic.networktopology.cloud;

/**
 * A provider call failed. {@link #errorCode()} is the provider's code, or {@code null} when the
 * failure happened on the client side (connection, credentials, interrupted wait).
 */
public class CloudClientException extends RuntimeException {

    private final String operation;
    private final String errorCode;

    public CloudClientException(String operation, String errorCode, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
        this.errorCode = errorCode;
    }

    public String operation() {
        return operation;
    }

    public String errorCode() {
        return errorCode;
    }

    public boolean isNotFound() {
        return errorCode != null && errorCode.endsWith("NotFound");
    }
}
