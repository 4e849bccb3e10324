package com.wirecrest.scraper.schedule.platform;

/**
 * Failure talking to the external job platform. {@code code} follows the same vocabulary the HTTP layer
 * reports: {@code timeout}, {@code io_error}, {@code interrupted}, {@code http_error},
 * {@code invalid_response}, {@code configuration} or {@code profile_not_found}.
 */
public class JobPlatformException extends RuntimeException {
    private final String code;
    private final int statusCode;
    private final boolean retryable;

    public JobPlatformException(String code, int statusCode, boolean retryable, String message) {
        super(message);
        this.code = code;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public JobPlatformException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.statusCode = 0;
        this.retryable = false;
    }

    public static JobPlatformException configuration(String message) {
        return new JobPlatformException("configuration", 0, false, message);
    }

    public String getCode() {
        return code;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
