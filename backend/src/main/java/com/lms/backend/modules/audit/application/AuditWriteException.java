package com.lms.backend.modules.audit.application;

import com.lms.backend.global.error.MonitorException;

public class AuditWriteException extends MonitorException {

    public static final String CODE = "AUDIT_WRITE_FAILED";

    public AuditWriteException(String detail, Throwable cause) {
        super(CODE, detail, cause);
    }
}
