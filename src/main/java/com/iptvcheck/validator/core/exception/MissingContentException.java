package com.iptvcheck.validator.core.exception;

/**
 * Domain exception thrown when an analysis is requested without any playlist or guide content.
 */
public class MissingContentException extends RuntimeException {

    public MissingContentException(String message) {
        super(message);
    }
}
