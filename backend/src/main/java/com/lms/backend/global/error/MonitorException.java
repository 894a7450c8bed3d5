package com.lms.backend.global.error;

/**
 * Base type for failures raised by the inactivity monitor. Every failure carries a stable,
 * upper-case code that appears in logs and cycle results.
 */
public class MonitorException extends RuntimeException {

    private final String code;
    private final String detail;

    public MonitorException(String code, String detail) {
        this(code, detail, null);
    }

    public MonitorException(String code, String detail, Throwable cause) {
        super(code + ": " + (detail != null && !detail.isBlank() ? detail : code), cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("MonitorException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
