package com.iptvcheck.validator.core.exception;

/**
 * Domain exception thrown when a serialized fix list cannot be read back.
 */
public class InvalidFixPayloadException extends RuntimeException {

    public InvalidFixPayloadException(String message) {
        super(message);
    }

    public InvalidFixPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
