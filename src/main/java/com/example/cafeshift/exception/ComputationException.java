package com.example.cafeshift.exception;

import org.springframework.http.HttpStatus;

/**
 * Bracket table inconsistencies: gaps, overlaps or ambiguous matches.
 */
public class ComputationException extends BusinessException {

    /**
     * @param message {@link String#format} pattern filled from {@code parameters}
     */
    public ComputationException(String message, Object... parameters) {
        super("COMPUTATION_ERROR", String.format(message, parameters), parameters);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }
}
