package com.lms.backend.modules.report.application;

import com.lms.backend.global.error.MonitorException;

public class ReportPersistException extends MonitorException {

    public static final String CODE = "REPORT_PERSIST_FAILED";

    public ReportPersistException(String detail, Throwable cause) {
        super(CODE, detail, cause);
    }
}
