package com.dating.discovery.exceptions;

/**
 * Unexpected server-side failure, such as a match row that stays invisible after an insert-or-ignore.
 */
public class InternalServerErrorException extends RuntimeException {

    public InternalServerErrorException(String message) {
        super(message);
    }

    public InternalServerErrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
