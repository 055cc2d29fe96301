package com.bank.mpin.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLogin(String outcome) {
        Counter.builder("auth.login.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRegistration(String outcome) {
        Counter.builder("auth.register.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRiskScore(String action, int score) {
        DistributionSummary.builder("risk.score")
                .tag("action", action)
                .register(registry)
                .record(score);
    }

    public void recordRiskFlag(String flag) {
        Counter.builder("risk.flag.count")
                .tag("flag", flag)
                .register(registry)
                .increment();
    }

    public void recordLedgerWriteFailure() {
        Counter.builder("ledger.write.failure.count")
                .register(registry)
                .increment();
    }

    public void recordLedgerPurged(int count) {
        Counter.builder("ledger.purged.count")
                .register(registry)
                .increment(count);
    }
}
