package com.iptvcheck.validator.core.exception;

/**
 * Domain exception thrown when a validation mode other than basic or advanced is requested.
 */
public class InvalidValidationModeException extends RuntimeException {

    public InvalidValidationModeException(String message) {
        super(message);
    }
}
