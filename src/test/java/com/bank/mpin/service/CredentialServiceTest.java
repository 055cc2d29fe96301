package com.bank.mpin.service;

import com.bank.mpin.config.KeyStorageConfig;
import com.bank.mpin.config.LedgerConfig;
import com.bank.mpin.config.LockoutConfig;
import com.bank.mpin.config.MetricsConfig;
import com.bank.mpin.config.RiskThresholdConfig;
import com.bank.mpin.config.SessionConfig;
import com.bank.mpin.crypto.CredentialHasher;
import com.bank.mpin.crypto.KeyCustodian;
import com.bank.mpin.crypto.TransportDecryptor;
import com.bank.mpin.engine.RiskRuleEngine;
import com.bank.mpin.exception.StorageUnavailableException;
import com.bank.mpin.engine.rules.FirstLoginRule;
import com.bank.mpin.engine.rules.HighFailureRateRule;
import com.bank.mpin.engine.rules.NewDeviceRule;
import com.bank.mpin.engine.rules.NewIpRule;
import com.bank.mpin.engine.rules.RapidAttemptsRule;
import com.bank.mpin.engine.rules.UnusualHourRule;
import com.bank.mpin.model.AttemptReason;
import com.bank.mpin.model.AuthOutcome;
import com.bank.mpin.model.AuthResult;
import com.bank.mpin.model.IdentityRecord;
import com.bank.mpin.model.LoginAttempt;
import com.bank.mpin.model.RiskAction;
import com.bank.mpin.model.RiskFlag;
import com.bank.mpin.testutil.ClientEncryption;
import com.bank.mpin.testutil.InMemoryIdentityRepository;
import com.bank.mpin.testutil.InMemoryLoginAttemptRepository;
import com.bank.mpin.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.bank.mpin.testutil.TestDataFactory.FINGERPRINT;
import static com.bank.mpin.testutil.TestDataFactory.IP;
import static com.bank.mpin.testutil.TestDataFactory.PHONE;
import static com.bank.mpin.testutil.TestDataFactory.USER_AGENT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CredentialServiceTest {

    private static final String MPIN = "482915";
    private static final String SECRET = "test-session-secret-0123456789abcdef0123456789abcdef";

    @TempDir
    static Path keyDir;

    private static KeyCustodian keyCustodian;

    private MutableClock clock;
    private InMemoryIdentityRepository identityRepository;
    private InMemoryLoginAttemptRepository attemptRepository;
    private CredentialHasher hasher;
    private SessionService sessionService;
    private SimpleMeterRegistry registry;
    private CredentialService credentialService;

    @BeforeAll
    static void generateKeys() {
        KeyStorageConfig keyConfig = new KeyStorageConfig();
        keyConfig.setDirectory(keyDir.toString());
        keyCustodian = new KeyCustodian(keyConfig);
        keyCustodian.init();
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-02-18T10:00:00Z"));
        identityRepository = new InMemoryIdentityRepository();
        attemptRepository = new InMemoryLoginAttemptRepository();
        hasher = spy(new CredentialHasher());
        registry = new SimpleMeterRegistry();

        LockoutConfig lockoutConfig = new LockoutConfig();
        RiskThresholdConfig riskConfig = new RiskThresholdConfig();
        SessionConfig sessionConfig = new SessionConfig();
        sessionConfig.setSecret(SECRET);
        MetricsConfig metricsConfig = new MetricsConfig(registry);

        IdentityService identityService = new IdentityService(identityRepository, lockoutConfig);
        LockoutService lockoutService = new LockoutService(identityService, lockoutConfig);
        AttemptLedgerService ledgerService = new AttemptLedgerService(attemptRepository, new LedgerConfig(),
                metricsConfig, clock);
        RiskRuleEngine engine = new RiskRuleEngine(List.of(
                new FirstLoginRule(riskConfig),
                new NewIpRule(riskConfig),
                new NewDeviceRule(riskConfig),
                new RapidAttemptsRule(riskConfig),
                new HighFailureRateRule(riskConfig),
                new UnusualHourRule(riskConfig)), Tracer.NOOP, metricsConfig);
        RiskScoringService riskScoringService = new RiskScoringService(ledgerService, engine, riskConfig, metricsConfig);
        sessionService = new SessionService(sessionConfig, clock);

        credentialService = new CredentialService(identityService, lockoutService, riskScoringService,
                ledgerService, sessionService, new TransportDecryptor(keyCustodian), hasher,
                lockoutConfig, metricsConfig, clock);
    }

    private static String encrypt(String mpin) {
        return ClientEncryption.encrypt(keyCustodian.publicKey(), mpin);
    }

    private AuthResult register() {
        return credentialService.register(PHONE, encrypt(MPIN), FINGERPRINT, IP, USER_AGENT);
    }

    private AuthResult login(String mpin) {
        return credentialService.login(PHONE, encrypt(mpin), FINGERPRINT, IP, USER_AGENT);
    }

    private IdentityRecord stored() {
        return identityRepository.findByPhone(PHONE).orElseThrow();
    }

    private LoginAttempt lastAttempt() {
        List<LoginAttempt> all = attemptRepository.all();
        return all.get(all.size() - 1);
    }

    // --- register ---

    @Test
    void register_newPhone_storesDigestAndIssuesSession() {
        AuthResult result = register();

        assertThat(result.getOutcome()).isEqualTo(AuthOutcome.SUCCESS);
        assertThat(result.getToken()).isNotBlank();
        assertThat(sessionService.verify(result.getToken())).isPresent();
        assertThat(result.getUser().getPhone()).isEqualTo(PHONE);
        assertThat(result.getUser().getName()).isEqualTo(IdentityRecord.DEFAULT_NAME);

        IdentityRecord record = stored();
        assertThat(record.getMpinDigest()).isNotEqualTo(MPIN).hasSize(128);
        assertThat(hasher.verify(MPIN, record.getMpinDigest(), record.getMpinSalt())).isTrue();
        assertThat(record.getFailedAttempts()).isZero();
        assertThat(record.getLockedUntil()).isZero();
        assertThat(record.getDevices()).singleElement()
                .satisfies(d -> {
                    assertThat(d.getFingerprint()).isEqualTo(FINGERPRINT);
                    assertThat(d.isTrusted()).isTrue();
                });

        assertThat(lastAttempt().isSuccess()).isTrue();
        assertThat(lastAttempt().getReason()).isEqualTo(AttemptReason.SUCCESS);
    }

    @Test
    void register_withoutFingerprint_bindsNoDevice() {
        AuthResult result = credentialService.register(PHONE, encrypt("1234"), null, IP, USER_AGENT);

        assertThat(result.isSuccess()).isTrue();
        assertThat(stored().getDevices()).isEmpty();
        assertThat(lastAttempt().getFingerprint()).isEqualTo(LoginAttempt.UNKNOWN_FINGERPRINT);
    }

    @Test
    void register_twice_returnsAlreadyRegisteredAndKeepsFirstRecord() {
        register();
        IdentityRecord first = stored();

        AuthResult second = credentialService.register(PHONE, encrypt("9999"), "other-device", IP, USER_AGENT);

        assertThat(second.getOutcome()).isEqualTo(AuthOutcome.ALREADY_REGISTERED);
        IdentityRecord after = stored();
        assertThat(after.getMpinDigest()).isEqualTo(first.getMpinDigest());
        assertThat(after.getMpinSalt()).isEqualTo(first.getMpinSalt());
        assertThat(after.getDevices()).hasSize(1);
    }

    @Test
    void register_undecryptablePayload_returnsInvalidCiphertext() {
        AuthResult result = credentialService.register(PHONE, "bm90LWVuY3J5cHRlZA==", FINGERPRINT, IP, USER_AGENT);

        assertThat(result.getOutcome()).isEqualTo(AuthOutcome.INVALID_CIPHERTEXT);
        assertThat(result.getMessage()).isEqualTo("Invalid encrypted data");
        assertThat(identityRepository.size()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {"123", "12345", "1234567", "12a4", " 1234", "1234\n", "١٢٣٤", ""})
    void register_badPinFormat_isRejected(String mpin) {
        AuthResult result = credentialService.register(PHONE, encrypt(mpin), FINGERPRINT, IP, USER_AGENT);

        assertThat(result.getOutcome()).isEqualTo(AuthOutcome.INVALID_PIN_FORMAT);
        assertThat(identityRepository.size()).isZero();
    }

    // --- login ---

    @Test
    void login_unknownPhone_returnsNotFound() {
        AuthResult result = login(MPIN);

        assertThat(result.getOutcome()).isEqualTo(AuthOutcome.NOT_FOUND);
        assertThat(attemptRepository.all()).isEmpty();
    }

    @Test
    void login_correctPin_issuesSessionWithRisk() {
        register();
        clock.advance(Duration.ofHours(1));

        AuthResult result = login(MPIN);

        assertThat(result.getOutcome()).isEqualTo(AuthOutcome.SUCCESS);
        assertThat(result.getToken()).isNotBlank();
        assertThat(result.getRiskScore()).isZero();
        assertThat(result.getRiskAction()).isEqualTo(RiskAction.ALLOW);
        assertThat(stored().getLastLoginAt()).isEqualTo(clock.millis());
        assertThat(lastAttempt().getReason()).isEqualTo(AttemptReason.SUCCESS);
        assertThat(registry.counter("auth.login.count", "outcome", "SUCCESS").count()).isEqualTo(1.0);
    }

    @Test
    void login_wrongPin_countsFailureAndReportsRemaining() {
        register();

        AuthResult result = login("000000");

        assertThat(result.getOutcome()).isEqualTo(AuthOutcome.WRONG_CREDENTIAL);
        assertThat(result.getAttemptsRemaining()).isEqualTo(4);
        assertThat(result.getMessage()).isEqualTo("Incorrect MPIN. 4 attempts remaining.");
        assertThat(stored().getFailedAttempts()).isEqualTo(1);
        assertThat(lastAttempt().getReason()).isEqualTo(AttemptReason.WRONG_MPIN);
        assertThat(lastAttempt().isSuccess()).isFalse();
    }

    @Test
    void login_wrongPin_whenCounterWriteFails_isStillInLedger() {
        register();
        identityRepository.rejectUpdates();

        assertThatThrownBy(() -> login("000000"))
                .isInstanceOf(StorageUnavailableException.class);

        assertThat(lastAttempt().getReason()).isEqualTo(AttemptReason.WRONG_MPIN);
        assertThat(lastAttempt().isSuccess()).isFalse();
        assertThat(stored().getFailedAttempts()).isZero();
    }

    @Test
    void login_fiveWrongPins_locksAndSixthSkipsVerification() {
        register();

        for (int i = 1; i <= 4; i++) {
            assertThat(login("000000").getAttemptsRemaining()).isEqualTo(5 - i);
        }
        AuthResult fifth = login("000000");
        assertThat(fifth.getOutcome()).isEqualTo(AuthOutcome.WRONG_CREDENTIAL);
        assertThat(fifth.getAttemptsRemaining()).isZero();
        assertThat(fifth.getLockedUntil()).isEqualTo(clock.millis() + 30 * 60_000L);
        assertThat(stored().getFailedAttempts()).isZero();

        clearInvocations(hasher);
        AuthResult sixth = login(MPIN);

        assertThat(sixth.getOutcome()).isEqualTo(AuthOutcome.ACCOUNT_LOCKED);
        assertThat(sixth.getLockedUntil()).isEqualTo(fifth.getLockedUntil());
        verify(hasher, never()).verify(anyString(), anyString(), anyString());
        assertThat(lastAttempt().getReason()).isEqualTo(AttemptReason.ACCOUNT_LOCKED);
    }

    @Test
    void login_afterLockExpires_isEvaluatedAgain() {
        register();
        for (int i = 0; i < 5; i++) {
            login("000000");
        }

        clock.advance(Duration.ofMinutes(30));
        AuthResult result = login(MPIN);

        assertThat(result.getOutcome()).isEqualTo(AuthOutcome.SUCCESS);
        assertThat(stored().getLockedUntil()).isZero();
        assertThat(stored().getFailedAttempts()).isZero();
    }

    @Test
    void login_successAfterFailures_resetsCounter() {
        register();
        login("000000");
        login("000000");
        assertThat(stored().getFailedAttempts()).isEqualTo(2);

        AuthResult result = login(MPIN);

        assertThat(result.isSuccess()).isTrue();
        assertThat(stored().getFailedAttempts()).isZero();
    }

    @Test
    void login_undecryptablePayload_isNotALockoutFailure() {
        register();

        AuthResult result = credentialService.login(PHONE, "AAAA", FINGERPRINT, IP, USER_AGENT);

        assertThat(result.getOutcome()).isEqualTo(AuthOutcome.INVALID_CIPHERTEXT);
        assertThat(stored().getFailedAttempts()).isZero();
        assertThat(lastAttempt().getReason()).isEqualTo(AttemptReason.INVALID_DATA);
        verify(hasher, times(0)).verify(anyString(), anyString(), anyString());
    }

    @Test
    void login_newDevice_addsBindingAndFlagsRisk() {
        register();
        clock.advance(Duration.ofHours(1));

        AuthResult result = credentialService.login(PHONE, encrypt(MPIN), "fp-new", IP, USER_AGENT);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRiskFlags()).containsExactly(RiskFlag.NEW_DEVICE);
        assertThat(result.getRiskScore()).isEqualTo(25);
        assertThat(stored().getDevices()).extracting("fingerprint")
                .containsExactlyInAnyOrder(FINGERPRINT, "fp-new");
    }

    @Test
    void login_knownDevice_updatesLastUsed() {
        register();
        clock.advance(Duration.ofHours(1));

        login(MPIN);

        assertThat(stored().getDevices()).singleElement()
                .satisfies(d -> assertThat(d.getLastUsedAt()).isEqualTo(clock.millis()));
    }

    @Test
    void login_highRisk_isBlockedBeforeDecryption() {
        register();
        long now = clock.millis();
        for (int i = 1; i <= 4; i++) {
            attemptRepository.save(LoginAttempt.builder()
                    .phone(PHONE).ip(IP).fingerprint(FINGERPRINT).success(false)
                    .reason(AttemptReason.WRONG_MPIN).timestamp(now - i * 1_000L).build());
        }
        clearInvocations(hasher);

        AuthResult result = credentialService.login(PHONE, encrypt(MPIN), "fp-unknown", "198.51.100.9", USER_AGENT);

        assertThat(result.getOutcome()).isEqualTo(AuthOutcome.RISK_BLOCKED);
        assertThat(result.getRequireOtpReverification()).isTrue();
        assertThat(result.getRiskFlags()).contains(RiskFlag.NEW_IP, RiskFlag.NEW_DEVICE, RiskFlag.RAPID_ATTEMPTS);
        assertThat(result.getRiskScore()).isGreaterThan(60);
        assertThat(result.getToken()).isNull();
        verify(hasher, never()).verify(anyString(), anyString(), anyString());
        assertThat(lastAttempt().getReason()).isEqualTo(AttemptReason.FRAUD_DETECTED);
        assertThat(lastAttempt().getRiskScore()).isEqualTo(result.getRiskScore());
    }

    @Test
    void isValidFormat_acceptsOnlyFourOrSixAsciiDigits() {
        assertThat(CredentialService.isValidFormat("0000")).isTrue();
        assertThat(CredentialService.isValidFormat("123456")).isTrue();
        assertThat(CredentialService.isValidFormat("12345")).isFalse();
        assertThat(CredentialService.isValidFormat(null)).isFalse();
    }
}
