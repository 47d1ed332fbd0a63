package com.dating.discovery.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Duration;
import java.util.Optional;

/**
 * Thrown when a rate-limited action is attempted after its quota for the current window is used up.
 */
@Getter
@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class QuotaExceededException extends RuntimeException {
    private final String quotaName;
    private final transient Duration retryAfter;

    public QuotaExceededException(String quotaName, Duration retryAfter) {
        super("Quota '" + quotaName + "' exhausted for the current window");
        this.quotaName = quotaName;
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
