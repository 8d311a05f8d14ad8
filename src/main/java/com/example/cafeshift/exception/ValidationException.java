package com.example.cafeshift.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed input, an illegal state transition, a date overlap or a negative net pay.
 */
public class ValidationException extends BusinessException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }

    public ValidationException(String errorCode, String message, Object... parameters) {
        super(errorCode, message, parameters);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
