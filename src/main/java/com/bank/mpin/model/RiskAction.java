package com.bank.mpin.model;

public enum RiskAction {
    ALLOW,
    WARN,
    BLOCK;

    public static RiskAction fromScore(int score, int warnThreshold, int blockThreshold) {
        if (score > blockThreshold) return BLOCK;
        if (score > warnThreshold) return WARN;
        return ALLOW;
    }
}
