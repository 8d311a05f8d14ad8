package com.example.cafeshift.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of every typed failure the workflow and payroll services report to their callers.
 */
public abstract class BusinessException extends RuntimeException {

    private final String errorCode;
    private final Object[] parameters;

    protected BusinessException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    protected BusinessException(String errorCode, String message, Throwable cause, Object... parameters) {
        super(message, cause);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }

    public abstract HttpStatus getStatus();
}
