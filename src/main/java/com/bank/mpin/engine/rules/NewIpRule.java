package com.bank.mpin.engine.rules;

import com.bank.mpin.config.RiskThresholdConfig;
import com.bank.mpin.engine.RiskContext;
import com.bank.mpin.engine.RiskRule;
import com.bank.mpin.model.LoginAttempt;
import com.bank.mpin.model.RiskFlag;
import com.bank.mpin.model.RuleResult;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fires when the request IP has never been used in a successful attempt,
 * provided at least one successful attempt exists.
 */
@Component
public class NewIpRule implements RiskRule {

    private final RiskThresholdConfig config;

    public NewIpRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public RiskFlag getFlag() {
        return RiskFlag.NEW_IP;
    }

    @Override
    public RuleResult evaluate(RiskContext context) {
        if (!context.hasHistory()) {
            return notTriggered("No history to compare against");
        }

        Set<String> knownIps = context.getHistory().stream()
                .filter(LoginAttempt::isSuccess)
                .map(LoginAttempt::getIp)
                .collect(Collectors.toSet());

        if (knownIps.isEmpty() || knownIps.contains(context.getCurrentIp())) {
            return notTriggered("IP address seen before");
        }
        return triggered(config.getPoints().getNewIp(),
                String.format("IP not among %d known IPs", knownIps.size()));
    }
}
