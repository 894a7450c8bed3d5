package com.lms.backend.modules.audit.application;

import com.lms.backend.global.error.MonitorException;

public class AuditReadException extends MonitorException {

    public static final String CODE = "AUDIT_READ_FAILED";

    public AuditReadException(String detail, Throwable cause) {
        super(CODE, detail, cause);
    }
}
