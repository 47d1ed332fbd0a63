package com.dating.discovery.exceptions;

import com.dating.discovery.models.Error;
import com.dating.discovery.utils.basic.ErrorUtility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;



/**
 * Maps engine exceptions onto HTTP responses carrying an {@link Error} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Error> handleNotFoundException(NotFoundException e) {
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.NOT_FOUND), HttpStatus.NOT_FOUND);
    }

    /**
     * Client errors are logged at warn and never retried.
     */
    @ExceptionHandler(InvalidOperationException.class)
    public ResponseEntity<Error> handleInvalidOperationException(InvalidOperationException e) {
        log.warn("Rejected invalid operation: {}", e.getMessage());
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    /**
     * Quota exhaustion is not fatal; the remaining window is returned both in the body and as a
     * {@code Retry-After} header when it is known.
     */
    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<Error> handleQuotaExceededException(QuotaExceededException e) {
        Error error = ErrorUtility.getQuotaError(e);
        HttpHeaders headers = new HttpHeaders();
        if (error.getRetryAfterSeconds() != null) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(error.getRetryAfterSeconds()));
        }
        return new ResponseEntity<>(error, headers, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Error> handleBadRequestException(BadRequestException e) {
        return new ResponseEntity<>(ErrorUtility.getParameterError(e.getMessage(), e.getParameter()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Error> handleValidationException(MethodArgumentNotValidException ex) {
        BindingResult bindingResult = ex.getBindingResult();
        StringBuilder errorMessage = new StringBuilder("Invalid request parameters:");

        for (FieldError fieldError : bindingResult.getFieldErrors()) {
            errorMessage.append(" Field '").append(fieldError.getField())
                    .append("' ").append(fieldError.getDefaultMessage()).append("; ");
        }
        return new ResponseEntity<>(ErrorUtility.getError(errorMessage.toString(), HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Error> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        String message = "Invalid value for parameter '" + e.getName() + "'";
        return new ResponseEntity<>(ErrorUtility.getParameterError(message, e.getName()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Store connectivity problems are transient; callers may retry with backoff.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Error> handleDataAccessException(DataAccessException e) {
        log.error("Store access failed: {}", e.getMessage(), e);
        return new ResponseEntity<>(ErrorUtility.getError("Store temporarily unavailable", HttpStatus.SERVICE_UNAVAILABLE),
                HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(InternalServerErrorException.class)
    public ResponseEntity<Error> handleInternalServerErrorException(InternalServerErrorException e) {
        log.error("Internal error: {}", e.getMessage(), e);
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
