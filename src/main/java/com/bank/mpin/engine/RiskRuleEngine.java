package com.bank.mpin.engine;

import com.bank.mpin.config.MetricsConfig;
import com.bank.mpin.model.RiskFlag;
import com.bank.mpin.model.RuleResult;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered {@link RiskRule} once against a login attempt.
 * Rules are keyed by flag and evaluated in flag declaration order.
 */
@Component
public class RiskRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskRuleEngine.class);

    private final Map<RiskFlag, RiskRule> rules;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public RiskRuleEngine(List<RiskRule> riskRules, Tracer tracer, MetricsConfig metricsConfig) {
        this.rules = new EnumMap<>(RiskFlag.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (RiskRule rule : riskRules) {
            RiskRule previous = rules.put(rule.getFlag(), rule);
            if (previous != null) {
                throw new IllegalStateException("Two risk rules registered for flag " + rule.getFlag());
            }
            log.info("Registered risk rule: {} -> {}", rule.getFlag(), rule.getClass().getSimpleName());
        }
    }

    public List<RuleResult> evaluateAll(RiskContext context) {
        List<RuleResult> results = new ArrayList<>();

        for (RiskRule rule : rules.values()) {
            Span span = tracer.nextSpan()
                    .name("risk.rule." + rule.getFlag().getCode())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                RuleResult result = rule.evaluate(context);
                results.add(result);
                span.tag("rule.triggered", String.valueOf(result.isTriggered()));

                if (result.isTriggered()) {
                    metricsConfig.recordRiskFlag(rule.getFlag().getCode());
                    log.debug("Risk rule {} fired: +{} ({})", rule.getFlag(), result.getPoints(), result.getReason());
                }
            } catch (RuntimeException e) {
                span.error(e);
                log.error("Error evaluating risk rule {}: {}", rule.getFlag(), e.getMessage(), e);
                // A broken rule must not block the login path
            } finally {
                span.end();
            }
        }

        return results;
    }
}
