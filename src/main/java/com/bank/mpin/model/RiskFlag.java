package com.bank.mpin.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskFlag {
    FIRST_LOGIN("first_login"),
    NEW_IP("new_ip"),
    NEW_DEVICE("new_device"),
    RAPID_ATTEMPTS("rapid_attempts"),
    HIGH_FAILURE_RATE("high_failure_rate"),
    UNUSUAL_HOUR("unusual_hour"),
    DETECTION_ERROR("detection_error");

    private final String code;

    RiskFlag(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
