package com.lms.backend.modules.activity.application;

import com.lms.backend.global.error.MonitorException;

public class StoreUnavailableException extends MonitorException {

    public static final String CODE = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String detail, Throwable cause) {
        super(CODE, detail, cause);
    }
}
