package com.example.cafeshift.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a concurrent caller already moved the record on. Callers may re-fetch and retry;
 * nothing retries internally.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message) {
        super("CONFLICT", message);
    }

    public ConflictException(String message, Throwable cause) {
        super("CONFLICT", message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
