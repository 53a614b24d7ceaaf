package com.example.organizationservice.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * Standard error response format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    public static final String CORRELATION_ID_KEY = "correlationId";

    private String code;
    private String message;
    private Instant timestamp;
    private String correlationId;
    private Map<String, String> errors;
    private Map<String, Object> details;

    public static ErrorResponse of(String code, String message) {
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .timestamp(Instant.now())
                .correlationId(MDC.get(CORRELATION_ID_KEY))
                .build();
    }

    /**
     * Create error response with field errors (for validation).
     */
    public static ErrorResponse withErrors(String code, String message, Map<String, String> errors) {
        ErrorResponse response = of(code, message);
        response.setErrors(errors);
        return response;
    }

    public static ErrorResponse withDetails(String code, String message, Map<String, Object> details) {
        ErrorResponse response = of(code, message);
        response.setDetails(details == null || details.isEmpty() ? null : details);
        return response;
    }
}
