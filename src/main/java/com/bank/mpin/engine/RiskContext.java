package com.bank.mpin.engine;

import com.bank.mpin.model.LoginAttempt;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Inputs shared by every login risk rule for one scoring call.
 */
@Data
@Builder
public class RiskContext {

    private String phone;
    private String currentIp;
    private String currentFingerprint;

    // Scoring instant in epoch millis; rules never read the wall clock
    private long now;

    // Attempts inside the history window, most recent first
    private List<LoginAttempt> history;

    public boolean hasHistory() {
        return history != null && !history.isEmpty();
    }
}
