package com.pumpscreener.exception;

/**
 * User-supplied setting that could not be applied. The previous value stays in effect.
 */
public class InvalidSettingException extends RuntimeException {

    public InvalidSettingException(String message) {
        super(message);
    }

    public InvalidSettingException(String message, Throwable cause) {
        super(message, cause);
    }
}
