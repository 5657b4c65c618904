package com.pumpscreener.exception;

public class AlertDeliveryException extends Exception {

    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
