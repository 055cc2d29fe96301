package com.bank.mpin.engine.rules;

import com.bank.mpin.config.RiskThresholdConfig;
import com.bank.mpin.engine.RiskContext;
import com.bank.mpin.engine.RiskRule;
import com.bank.mpin.model.RiskFlag;
import com.bank.mpin.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * An identity with no attempts in the history window is an unseen pattern.
 */
@Component
public class FirstLoginRule implements RiskRule {

    private final RiskThresholdConfig config;

    public FirstLoginRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public RiskFlag getFlag() {
        return RiskFlag.FIRST_LOGIN;
    }

    @Override
    public RuleResult evaluate(RiskContext context) {
        if (context.hasHistory()) {
            return notTriggered("Login history present");
        }
        return triggered(config.getPoints().getFirstLogin(), "No login attempts in the history window");
    }
}
