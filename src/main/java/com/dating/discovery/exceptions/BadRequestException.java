package com.dating.discovery.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A paging or query parameter outside its accepted range (HTTP 400). Not a domain rule violation.
 */
@Getter
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class BadRequestException extends RuntimeException {
    private final String parameter;

    public BadRequestException(String parameter, Object value, String rule) {
        super("Parameter '" + parameter + "' " + rule + ", got " + value);
        this.parameter = parameter;
    }
}
