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
 * Fires when the device fingerprint has never completed a successful attempt,
 * provided at least one successful attempt exists.
 */
@Component
public class NewDeviceRule implements RiskRule {

    private final RiskThresholdConfig config;

    public NewDeviceRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public RiskFlag getFlag() {
        return RiskFlag.NEW_DEVICE;
    }

    @Override
    public RuleResult evaluate(RiskContext context) {
        if (!context.hasHistory()) {
            return notTriggered("No history to compare against");
        }

        Set<String> knownFingerprints = context.getHistory().stream()
                .filter(LoginAttempt::isSuccess)
                .map(LoginAttempt::getFingerprint)
                .collect(Collectors.toSet());

        if (knownFingerprints.isEmpty() || knownFingerprints.contains(context.getCurrentFingerprint())) {
            return notTriggered("Device seen before");
        }
        return triggered(config.getPoints().getNewDevice(),
                String.format("Device not among %d known devices", knownFingerprints.size()));
    }
}
