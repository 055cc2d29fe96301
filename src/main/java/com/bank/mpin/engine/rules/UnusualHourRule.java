package com.bank.mpin.engine.rules;

import com.bank.mpin.config.RiskThresholdConfig;
import com.bank.mpin.engine.RiskContext;
import com.bank.mpin.engine.RiskRule;
import com.bank.mpin.model.RiskFlag;
import com.bank.mpin.model.RuleResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Logins between 02:00 and 05:59 (configured zone) get a small bump, with or without history.
 */
@Component
public class UnusualHourRule implements RiskRule {

    private final RiskThresholdConfig config;

    public UnusualHourRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public RiskFlag getFlag() {
        return RiskFlag.UNUSUAL_HOUR;
    }

    @Override
    public RuleResult evaluate(RiskContext context) {
        int hour = Instant.ofEpochMilli(context.getNow())
                .atZone(ZoneId.of(config.getZoneId()))
                .getHour();

        if (hour < config.getUnusualHourStart() || hour > config.getUnusualHourEnd()) {
            return notTriggered("Login hour " + hour + " is usual");
        }
        return triggered(config.getPoints().getUnusualHour(), "Login at unusual hour " + hour);
    }
}
