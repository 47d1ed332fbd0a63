package com.dating.discovery.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a profile the caller refers to does not exist.
 * <p>
 * Distinct from "no settings yet": a user with a profile but no stored settings resolves to defaults.
 * </p>
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
