package com.bank.mpin.engine;

import com.bank.mpin.model.RiskFlag;
import com.bank.mpin.model.RuleResult;

/**
 * One additive signal in the login risk score. Each implementation raises a single flag.
 */
public interface RiskRule {

    RiskFlag getFlag();

    /**
     * Evaluate the rule once for the current attempt.
     *
     * @return a triggered result carrying the rule's points, or a non-triggered result with zero points
     */
    RuleResult evaluate(RiskContext context);

    default RuleResult triggered(int points, String reason) {
        return RuleResult.builder()
                .flag(getFlag())
                .triggered(true)
                .points(points)
                .reason(reason)
                .build();
    }

    default RuleResult notTriggered(String reason) {
        return RuleResult.builder()
                .flag(getFlag())
                .triggered(false)
                .points(0)
                .reason(reason)
                .build();
    }
}
