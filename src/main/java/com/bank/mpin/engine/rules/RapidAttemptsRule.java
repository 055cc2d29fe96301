package com.bank.mpin.engine.rules;

import com.bank.mpin.config.RiskThresholdConfig;
import com.bank.mpin.engine.RiskContext;
import com.bank.mpin.engine.RiskRule;
import com.bank.mpin.model.RiskFlag;
import com.bank.mpin.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Counts attempts inside the rapid window ending at the scoring instant, e.g. more
 * than 3 attempts in the last 5 minutes.
 */
@Component
public class RapidAttemptsRule implements RiskRule {

    private final RiskThresholdConfig config;

    public RapidAttemptsRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public RiskFlag getFlag() {
        return RiskFlag.RAPID_ATTEMPTS;
    }

    @Override
    public RuleResult evaluate(RiskContext context) {
        if (!context.hasHistory()) {
            return notTriggered("No history to compare against");
        }

        long windowStart = context.getNow() - config.getRapidWindowMillis();
        long recent = context.getHistory().stream()
                .filter(a -> a.getTimestamp() >= windowStart)
                .count();

        if (recent <= config.getRapidAttemptThreshold()) {
            return notTriggered("Attempt rate within normal range");
        }
        return triggered(config.getPoints().getRapidAttempts(),
                String.format("%d attempts in the last %d minutes (threshold %d)",
                        recent, config.getRapidWindowMinutes(), config.getRapidAttemptThreshold()));
    }
}
