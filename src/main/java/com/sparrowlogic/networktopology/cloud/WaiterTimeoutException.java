package com.sparrowlogic.networktopology.cloud;

public class WaiterTimeoutException extends CloudClientException {

    public WaiterTimeoutException(String operation, String message, Throwable cause) {
        super(operation, null, message, cause);
    }
}
