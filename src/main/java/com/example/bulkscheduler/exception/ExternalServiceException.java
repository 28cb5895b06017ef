package com.example.bulkscheduler.exception;

import lombok.Getter;

/**
 * Exception for generation service communication failures.
 * Carries the HTTP status and body for error responses, and marks calls
 * refused by an open circuit breaker without reaching the service.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;
    private final boolean circuitOpen;

    public ExternalServiceException(String serviceName, String message) {
        this(serviceName, String.format("[%s] %s", serviceName, message), null, null, null, false);
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        this(serviceName, String.format("[%s] %s", serviceName, cause.getMessage()), cause, null, null, false);
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        this(serviceName, String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody),
                null, httpStatusCode, responseBody, false);
    }

    private ExternalServiceException(String serviceName, String message, Exception cause,
                                     Integer httpStatusCode, String responseBody, boolean circuitOpen) {
        super(message, cause);
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        this.circuitOpen = circuitOpen;
    }

    /**
     * The call was refused locally because the service's circuit breaker is open
     */
    public static ExternalServiceException circuitOpen(String serviceName, Exception cause) {
        return new ExternalServiceException(serviceName,
                String.format("[%s] Service temporarily unavailable (circuit breaker open)", serviceName),
                cause, null, null, true);
    }
}
