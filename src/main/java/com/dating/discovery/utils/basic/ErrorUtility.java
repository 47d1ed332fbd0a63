package com.dating.discovery.utils.basic;

import com.dating.discovery.exceptions.QuotaExceededException;
import com.dating.discovery.models.Error;
import lombok.experimental.UtilityClass;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

@UtilityClass
public class ErrorUtility {

    public static Error getError(String errorMsg, HttpStatus status) {
        return baseError(errorMsg, status).build();
    }

    public static Error getParameterError(String errorMsg, String parameter) {
        return baseError(errorMsg, HttpStatus.BAD_REQUEST).parameter(parameter).build();
    }

    /**
     * Quota errors carry the seconds left in the window when the window is known.
     */
    public static Error getQuotaError(QuotaExceededException e) {
        return baseError(e.getMessage(), HttpStatus.TOO_MANY_REQUESTS)
                .retryAfterSeconds(e.retryAfter().map(Duration::toSeconds).orElse(null))
                .build();
    }

    private static Error.ErrorBuilder baseError(String errorMsg, HttpStatus status) {
        return Error.builder()
                .uid(UUID.randomUUID().toString())
                .status(status)
                .timestamp(LocalDateTime.now(Clock.systemUTC()))
                .errorMsg(errorMsg);
    }
}
