package com.bank.mpin.engine.rules;

import com.bank.mpin.config.RiskThresholdConfig;
import com.bank.mpin.engine.RiskContext;
import com.bank.mpin.model.LoginAttempt;
import com.bank.mpin.model.RuleResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;

import static com.bank.mpin.testutil.TestDataFactory.createAttempt;
import static org.assertj.core.api.Assertions.assertThat;

class RiskRulesTest {

    private static final long NOW = Instant.parse("2025-02-18T10:00:00Z").toEpochMilli();
    private static final long MINUTE = 60_000L;
    private static final long HOUR = 60 * MINUTE;

    private final RiskThresholdConfig config = new RiskThresholdConfig();

    private RiskContext context(String ip, String fingerprint, long now, List<LoginAttempt> history) {
        return RiskContext.builder()
                .phone("919876543210")
                .currentIp(ip)
                .currentFingerprint(fingerprint)
                .now(now)
                .history(history)
                .build();
    }

    @Test
    void firstLogin_emptyHistory_addsFivePoints() {
        RuleResult result = new FirstLoginRule(config).evaluate(context("A", "F", NOW, List.of()));

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getPoints()).isEqualTo(5);
    }

    @Test
    void firstLogin_withHistory_doesNotFire() {
        RuleResult result = new FirstLoginRule(config).evaluate(
                context("A", "F", NOW, List.of(createAttempt("A", "F", true, NOW - HOUR))));

        assertThat(result.isTriggered()).isFalse();
        assertThat(result.getPoints()).isZero();
    }

    @Test
    void newIp_unseenAmongSuccesses_addsTwentyPoints() {
        List<LoginAttempt> history = List.of(
                createAttempt("A", "F", true, NOW - HOUR),
                createAttempt("B", "F", false, NOW - 2 * HOUR));

        RuleResult result = new NewIpRule(config).evaluate(context("B", "F", NOW, history));

        // B only appears on a failed attempt
        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getPoints()).isEqualTo(20);
    }

    @Test
    void newIp_knownIp_doesNotFire() {
        RuleResult result = new NewIpRule(config).evaluate(
                context("A", "F", NOW, List.of(createAttempt("A", "F", true, NOW - HOUR))));

        assertThat(result.isTriggered()).isFalse();
    }

    @Test
    void newIp_noSuccessfulHistory_doesNotFire() {
        RuleResult result = new NewIpRule(config).evaluate(
                context("B", "F", NOW, List.of(createAttempt("A", "F", false, NOW - HOUR))));

        assertThat(result.isTriggered()).isFalse();
    }

    @Test
    void newDevice_unseenFingerprint_addsTwentyFivePoints() {
        RuleResult result = new NewDeviceRule(config).evaluate(
                context("A", "G", NOW, List.of(createAttempt("A", "F", true, NOW - HOUR))));

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getPoints()).isEqualTo(25);
    }

    @Test
    void newDevice_knownFingerprint_doesNotFire() {
        RuleResult result = new NewDeviceRule(config).evaluate(
                context("B", "F", NOW, List.of(createAttempt("A", "F", true, NOW - HOUR))));

        assertThat(result.isTriggered()).isFalse();
    }

    @Test
    void rapidAttempts_fourInFiveMinutes_addsThirtyPoints() {
        List<LoginAttempt> history = List.of(
                createAttempt("A", "F", true, NOW - MINUTE),
                createAttempt("A", "F", true, NOW - 2 * MINUTE),
                createAttempt("A", "F", true, NOW - 3 * MINUTE),
                createAttempt("A", "F", true, NOW - 5 * MINUTE));

        RuleResult result = new RapidAttemptsRule(config).evaluate(context("A", "F", NOW, history));

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getPoints()).isEqualTo(30);
    }

    @Test
    void rapidAttempts_threeInWindow_doesNotFire() {
        List<LoginAttempt> history = List.of(
                createAttempt("A", "F", true, NOW - MINUTE),
                createAttempt("A", "F", true, NOW - 2 * MINUTE),
                createAttempt("A", "F", true, NOW - 3 * MINUTE),
                createAttempt("A", "F", true, NOW - 5 * MINUTE - 1));

        RuleResult result = new RapidAttemptsRule(config).evaluate(context("A", "F", NOW, history));

        assertThat(result.isTriggered()).isFalse();
    }

    @Test
    void highFailureRate_moreThanHalfFailed_addsFifteenPoints() {
        List<LoginAttempt> history = List.of(
                createAttempt("A", "F", false, NOW - HOUR),
                createAttempt("A", "F", false, NOW - 2 * HOUR),
                createAttempt("A", "F", true, NOW - 3 * HOUR));

        RuleResult result = new HighFailureRateRule(config).evaluate(context("A", "F", NOW, history));

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getPoints()).isEqualTo(15);
    }

    @Test
    void highFailureRate_exactlyHalf_doesNotFire() {
        List<LoginAttempt> history = List.of(
                createAttempt("A", "F", false, NOW - HOUR),
                createAttempt("A", "F", true, NOW - 2 * HOUR));

        RuleResult result = new HighFailureRateRule(config).evaluate(context("A", "F", NOW, history));

        assertThat(result.isTriggered()).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
            "2025-02-18T01:59:59Z, false",
            "2025-02-18T02:00:00Z, true",
            "2025-02-18T03:30:00Z, true",
            "2025-02-18T05:59:59Z, true",
            "2025-02-18T06:00:00Z, false",
            "2025-02-18T14:00:00Z, false"
    })
    void unusualHour_firesForHoursTwoThroughFive(String instant, boolean expected) {
        long now = Instant.parse(instant).toEpochMilli();

        RuleResult result = new UnusualHourRule(config).evaluate(context("A", "F", now, List.of()));

        assertThat(result.isTriggered()).isEqualTo(expected);
        assertThat(result.getPoints()).isEqualTo(expected ? 10 : 0);
    }

    @Test
    void unusualHour_usesConfiguredZone() {
        config.setZoneId("Asia/Kolkata");
        // 21:00 UTC is 02:30 in India
        long now = Instant.parse("2025-02-17T21:00:00Z").toEpochMilli();

        RuleResult result = new UnusualHourRule(config).evaluate(context("A", "F", now, List.of()));

        assertThat(result.isTriggered()).isTrue();
    }
}
