package com.example.organizationservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception class for all business exceptions.
 * Carries a stable error code, the HTTP status it maps to and structured
 * details rendered into the error body.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final String code;
    private final HttpStatus status;
    private final Map<String, Object> details;

    protected BaseException(String code, String message, HttpStatus status) {
        this(code, message, status, Map.of());
    }

    protected BaseException(String code, String message, HttpStatus status, Map<String, Object> details) {
        super(message);
        this.code = code;
        this.status = status;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
