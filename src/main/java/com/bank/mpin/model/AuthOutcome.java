package com.bank.mpin.model;

public enum AuthOutcome {
    SUCCESS,
    ALREADY_REGISTERED,
    NOT_FOUND,
    ACCOUNT_LOCKED,
    RISK_BLOCKED,
    WRONG_CREDENTIAL,
    INVALID_CIPHERTEXT,
    INVALID_PIN_FORMAT;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
