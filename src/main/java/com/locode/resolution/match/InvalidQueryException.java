package com.locode.resolution.match;

/**
 * Runtime exception thrown for malformed user input such as an empty query
 * or non-numeric coordinates.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
