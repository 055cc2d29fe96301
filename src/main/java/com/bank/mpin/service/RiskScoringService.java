package com.bank.mpin.service;

import com.bank.mpin.config.MetricsConfig;
import com.bank.mpin.config.RiskThresholdConfig;
import com.bank.mpin.engine.RiskContext;
import com.bank.mpin.engine.RiskRuleEngine;
import com.bank.mpin.model.LoginAttempt;
import com.bank.mpin.model.RiskAction;
import com.bank.mpin.model.RiskAssessment;
import com.bank.mpin.model.RiskFlag;
import com.bank.mpin.model.RuleResult;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Scores a login attempt from the identity's recent attempt history.
 *
 * Score = sum of the points of every triggered rule, clamped to [0, 100].
 * Action: ALLOW when score <= warnThreshold, WARN up to blockThreshold, BLOCK above.
 * The result depends only on the ledger contents and {@code now}.
 */
@Service
public class RiskScoringService {

    private static final Logger log = LoggerFactory.getLogger(RiskScoringService.class);

    private static final int MIN_SCORE = 0;
    private static final int MAX_SCORE = 100;

    private final AttemptLedgerService ledgerService;
    private final RiskRuleEngine ruleEngine;
    private final RiskThresholdConfig thresholdConfig;
    private final MetricsConfig metricsConfig;

    public RiskScoringService(AttemptLedgerService ledgerService,
                              RiskRuleEngine ruleEngine,
                              RiskThresholdConfig thresholdConfig,
                              MetricsConfig metricsConfig) {
        this.ledgerService = ledgerService;
        this.ruleEngine = ruleEngine;
        this.thresholdConfig = thresholdConfig;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "risk.score", contextualName = "score-login-risk")
    public RiskAssessment score(String phone, String currentIp, String currentFingerprint, long now) {
        List<LoginAttempt> history;
        try {
            history = ledgerService.recentFor(phone,
                    now - thresholdConfig.getHistoryWindowMillis(),
                    thresholdConfig.getHistoryLimit());
        } catch (RuntimeException e) {
            log.error("Login history unavailable for phone={}, using fallback risk score: {}",
                    PhoneNumbers.mask(phone), e.getMessage());
            RiskAssessment fallback = RiskAssessment.fallback(thresholdConfig.getFallbackScore(), now);
            metricsConfig.recordRiskFlag(RiskFlag.DETECTION_ERROR.getCode());
            metricsConfig.recordRiskScore(fallback.getAction().name(), fallback.getScore());
            return fallback;
        }

        RiskContext context = RiskContext.builder()
                .phone(phone)
                .currentIp(currentIp)
                .currentFingerprint(currentFingerprint)
                .now(now)
                .history(history)
                .build();

        List<RuleResult> results = ruleEngine.evaluateAll(context);
        return computeResult(results, now);
    }

    RiskAssessment computeResult(List<RuleResult> results, long now) {
        int total = 0;
        Set<RiskFlag> flags = EnumSet.noneOf(RiskFlag.class);
        for (RuleResult result : results) {
            if (result.isTriggered()) {
                total += result.getPoints();
                flags.add(result.getFlag());
            }
        }

        int score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, total));
        RiskAction action = RiskAction.fromScore(score,
                thresholdConfig.getWarnThreshold(), thresholdConfig.getBlockThreshold());

        metricsConfig.recordRiskScore(action.name(), score);

        return RiskAssessment.builder()
                .score(score)
                .flags(flags)
                .action(action)
                .ruleResults(results)
                .evaluatedAt(now)
                .build();
    }
}
