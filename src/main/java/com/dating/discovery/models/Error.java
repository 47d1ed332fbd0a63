package com.dating.discovery.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;

/**
 * Error body returned by every failing endpoint. {@code parameter} names the offending request
 * parameter for 400s; {@code retryAfterSeconds} mirrors the {@code Retry-After} header for 429s.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Error {
    private String uid;
    private HttpStatus status;
    private LocalDateTime timestamp;
    private String errorMsg;
    private String parameter;
    private Long retryAfterSeconds;
}
