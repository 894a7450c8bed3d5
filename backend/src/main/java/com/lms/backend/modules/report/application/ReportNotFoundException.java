package com.lms.backend.modules.report.application;

import com.lms.backend.global.error.MonitorException;

public class ReportNotFoundException extends MonitorException {

    public static final String CODE = "REPORT_NOT_FOUND";

    public ReportNotFoundException(String detail) {
        super(CODE, detail);
    }

    public ReportNotFoundException(String detail, Throwable cause) {
        super(CODE, detail, cause);
    }
}
