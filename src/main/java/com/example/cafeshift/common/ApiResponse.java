package com.example.cafeshift.common;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Envelope for every endpoint. Failures carry a machine-readable {@code errorCode} in
 * {@code meta}; payroll runs put their counters there as well.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static final String ERROR_CODE = "errorCode";

    public ApiResponse {
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, null);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, null);
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta);
    }

    public static <T> ApiResponse<T> failure(String message) {
        return new ApiResponse<>(false, message, null, null);
    }

    public static <T> ApiResponse<T> failure(String message, Map<String, Object> meta) {
        return new ApiResponse<>(false, message, null, meta);
    }

    public static <T> ApiResponse<T> error(String errorCode, String message) {
        return new ApiResponse<>(false, message, null, Map.of(ERROR_CODE, errorCode));
    }

    public static <T> ApiResponse<T> error(String errorCode, String message, Map<String, ?> details) {
        Map<String, Object> meta = new LinkedHashMap<>(details);
        meta.put(ERROR_CODE, errorCode);
        return new ApiResponse<>(false, message, null, meta);
    }
}
