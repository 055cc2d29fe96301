package com.bank.mpin.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttemptReason {
    SUCCESS("success"),
    WRONG_MPIN("wrong_mpin"),
    ACCOUNT_LOCKED("account_locked"),
    FRAUD_DETECTED("fraud_detected"),
    OTP_FAILED("otp_failed"),
    INVALID_DATA("invalid_data");

    private final String code;

    AttemptReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AttemptReason fromCode(String code) {
        for (AttemptReason reason : values()) {
            if (reason.code.equals(code)) return reason;
        }
        throw new IllegalArgumentException("Unknown attempt reason: " + code);
    }
}
