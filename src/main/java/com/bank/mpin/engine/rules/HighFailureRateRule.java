package com.bank.mpin.engine.rules;

import com.bank.mpin.config.RiskThresholdConfig;
import com.bank.mpin.engine.RiskContext;
import com.bank.mpin.engine.RiskRule;
import com.bank.mpin.model.RiskFlag;
import com.bank.mpin.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Fires when more than half of the attempts in the history window failed.
 * Compared as {@code 2 * failed > total} to stay in integer arithmetic.
 */
@Component
public class HighFailureRateRule implements RiskRule {

    private final RiskThresholdConfig config;

    public HighFailureRateRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public RiskFlag getFlag() {
        return RiskFlag.HIGH_FAILURE_RATE;
    }

    @Override
    public RuleResult evaluate(RiskContext context) {
        if (!context.hasHistory()) {
            return notTriggered("No history to compare against");
        }

        int total = context.getHistory().size();
        long failed = context.getHistory().stream()
                .filter(a -> !a.isSuccess())
                .count();

        if (failed * 2 <= total) {
            return notTriggered("Failure rate within normal range");
        }
        return triggered(config.getPoints().getHighFailureRate(),
                String.format("%d of %d recent attempts failed", failed, total));
    }
}
