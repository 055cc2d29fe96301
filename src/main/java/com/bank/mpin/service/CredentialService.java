package com.bank.mpin.service;

import com.bank.mpin.config.LockoutConfig;
import com.bank.mpin.config.MetricsConfig;
import com.bank.mpin.crypto.CredentialHasher;
import com.bank.mpin.crypto.TransportDecryptor;
import com.bank.mpin.exception.DecryptionException;
import com.bank.mpin.model.AttemptReason;
import com.bank.mpin.model.AuthOutcome;
import com.bank.mpin.model.AuthResult;
import com.bank.mpin.model.DeviceBinding;
import com.bank.mpin.model.IdentityRecord;
import com.bank.mpin.model.IssuedSession;
import com.bank.mpin.model.LockoutState;
import com.bank.mpin.model.LoginAttempt;
import com.bank.mpin.model.RiskAction;
import com.bank.mpin.model.RiskAssessment;
import com.bank.mpin.model.UserView;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Registration and login orchestration.
 *
 * Login flow:
 * 1. Look up the identity by phone
 * 2. Reject locked identities before any credential or risk work
 * 3. Score the attempt against recent history; BLOCK stops here
 * 4. Decrypt the transport-encrypted MPIN
 * 5. Verify against the stored digest, updating the lockout state
 * 6. On success bind the device and issue a session
 *
 * Every login verdict after step 1 is appended to the attempt ledger.
 */
@Service
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private static final Pattern MPIN_FORMAT = Pattern.compile("[0-9]{4}|[0-9]{6}");

    private final IdentityService identityService;
    private final LockoutService lockoutService;
    private final RiskScoringService riskScoringService;
    private final AttemptLedgerService ledgerService;
    private final SessionService sessionService;
    private final TransportDecryptor transportDecryptor;
    private final CredentialHasher credentialHasher;
    private final LockoutConfig lockoutConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public CredentialService(IdentityService identityService,
                             LockoutService lockoutService,
                             RiskScoringService riskScoringService,
                             AttemptLedgerService ledgerService,
                             SessionService sessionService,
                             TransportDecryptor transportDecryptor,
                             CredentialHasher credentialHasher,
                             LockoutConfig lockoutConfig,
                             MetricsConfig metricsConfig,
                             Clock clock) {
        this.identityService = identityService;
        this.lockoutService = lockoutService;
        this.riskScoringService = riskScoringService;
        this.ledgerService = ledgerService;
        this.sessionService = sessionService;
        this.transportDecryptor = transportDecryptor;
        this.credentialHasher = credentialHasher;
        this.lockoutConfig = lockoutConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Create a credential for a phone that has none yet.
     *
     * @param phone normalized phone number
     */
    @Observed(name = "auth.register", contextualName = "register-mpin")
    public AuthResult register(String phone, String encryptedMpin, String fingerprint, String ip, String userAgent) {
        AuthResult result = doRegister(phone, encryptedMpin, fingerprint, ip, userAgent);
        metricsConfig.recordRegistration(result.getOutcome().name());
        return result;
    }

    private AuthResult doRegister(String phone, String encryptedMpin, String fingerprint, String ip, String userAgent) {
        if (identityService.find(phone).isPresent()) {
            return AuthResult.of(AuthOutcome.ALREADY_REGISTERED, "User already registered. Please login instead.");
        }

        Optional<String> mpin = decrypt(encryptedMpin);
        if (mpin.isEmpty()) {
            return AuthResult.of(AuthOutcome.INVALID_CIPHERTEXT, DecryptionException.GENERIC_MESSAGE);
        }
        if (!isValidFormat(mpin.get())) {
            return AuthResult.of(AuthOutcome.INVALID_PIN_FORMAT, "MPIN must be exactly 4 or 6 digits");
        }

        long now = clock.millis();
        String salt = credentialHasher.newSalt();

        IdentityRecord identity = IdentityRecord.builder()
                .identityId(UUID.randomUUID().toString())
                .phone(phone)
                .mpinSalt(salt)
                .mpinDigest(credentialHasher.hash(mpin.get(), salt))
                .devices(new ArrayList<>())
                .createdAt(now)
                .build();
        if (hasFingerprint(fingerprint)) {
            identity.getDevices().add(DeviceBinding.builder()
                    .fingerprint(fingerprint)
                    .userAgent(userAgent)
                    .lastUsedAt(now)
                    .trusted(true)
                    .build());
        }

        if (!identityService.create(identity)) {
            // Lost a race with a concurrent registration for the same phone
            return AuthResult.of(AuthOutcome.ALREADY_REGISTERED, "User already registered. Please login instead.");
        }

        IssuedSession session = sessionService.issue(identity.getIdentityId(), phone);
        recordAttempt(phone, ip, fingerprint, userAgent, true, AttemptReason.SUCCESS, 0, now);

        log.info("Registered identity {} for phone={}", identity.getIdentityId(), PhoneNumbers.mask(phone));

        return AuthResult.builder()
                .outcome(AuthOutcome.SUCCESS)
                .message("Registration successful! Welcome to SmartBank.")
                .token(session.token())
                .expiresAt(session.expiresAt())
                .user(UserView.of(identity))
                .build();
    }

    /**
     * Authenticate a registered phone with its MPIN.
     *
     * @param phone normalized phone number
     */
    @Observed(name = "auth.login", contextualName = "login-mpin")
    public AuthResult login(String phone, String encryptedMpin, String fingerprint, String ip, String userAgent) {
        AuthResult result = doLogin(phone, encryptedMpin, fingerprint, ip, userAgent);
        metricsConfig.recordLogin(result.getOutcome().name());
        return result;
    }

    private AuthResult doLogin(String phone, String encryptedMpin, String fingerprint, String ip, String userAgent) {
        long now = clock.millis();
        String deviceKey = hasFingerprint(fingerprint) ? fingerprint : LoginAttempt.UNKNOWN_FINGERPRINT;

        // 1. Identity
        Optional<IdentityRecord> found = identityService.find(phone);
        if (found.isEmpty()) {
            return AuthResult.of(AuthOutcome.NOT_FOUND, "User not found. Please register first.");
        }
        IdentityRecord identity = found.get();

        // 2. Lockout, before any credential or risk work
        LockoutState lockout = lockoutService.check(identity, now);
        if (lockout.isLocked(now)) {
            recordAttempt(phone, ip, deviceKey, userAgent, false, AttemptReason.ACCOUNT_LOCKED, 0, now);
            log.warn("Login rejected for locked phone={} until {}", PhoneNumbers.mask(phone), lockout.lockedUntil());
            return AuthResult.builder()
                    .outcome(AuthOutcome.ACCOUNT_LOCKED)
                    .message("Account locked due to too many failed attempts. Try again after "
                            + Instant.ofEpochMilli(lockout.lockedUntil()) + ".")
                    .lockedUntil(lockout.lockedUntil())
                    .attemptsRemaining(0)
                    .build();
        }

        // 3. Risk
        RiskAssessment risk = riskScoringService.score(phone, ip, deviceKey, now);
        if (risk.getAction() == RiskAction.BLOCK) {
            recordAttempt(phone, ip, deviceKey, userAgent, false, AttemptReason.FRAUD_DETECTED, risk.getScore(), now);
            log.warn("Login blocked for phone={}: risk score={} flags={}",
                    PhoneNumbers.mask(phone), risk.getScore(), risk.getFlags());
            return AuthResult.builder()
                    .outcome(AuthOutcome.RISK_BLOCKED)
                    .message("Suspicious activity detected. Please verify via OTP again.")
                    .riskScore(risk.getScore())
                    .riskFlags(risk.getFlags())
                    .riskAction(risk.getAction())
                    .requireOtpReverification(true)
                    .build();
        }
        if (risk.getAction() == RiskAction.WARN) {
            log.warn("Elevated login risk for phone={}: score={} flags={}",
                    PhoneNumbers.mask(phone), risk.getScore(), risk.getFlags());
        }

        // 4. Transport decryption; not a lockout failure
        Optional<String> mpin = decrypt(encryptedMpin);
        if (mpin.isEmpty()) {
            recordAttempt(phone, ip, deviceKey, userAgent, false, AttemptReason.INVALID_DATA, risk.getScore(), now);
            return AuthResult.of(AuthOutcome.INVALID_CIPHERTEXT, DecryptionException.GENERIC_MESSAGE);
        }

        // 5. Credential check; ledger entry precedes the counter write
        if (!credentialHasher.verify(mpin.get(), identity.getMpinDigest(), identity.getMpinSalt())) {
            recordAttempt(phone, ip, deviceKey, userAgent, false, AttemptReason.WRONG_MPIN, risk.getScore(), now);
            LockoutState after = lockoutService.recordFailure(phone, now);

            int remaining = lockoutService.attemptsRemaining(after, now);
            log.warn("Wrong MPIN for phone={}, {} attempts remaining", PhoneNumbers.mask(phone), remaining);

            return AuthResult.builder()
                    .outcome(AuthOutcome.WRONG_CREDENTIAL)
                    .message(remaining > 0
                            ? "Incorrect MPIN. " + remaining + " attempts remaining."
                            : "Incorrect MPIN. Account has been locked for "
                                    + lockoutConfig.getLockDurationMinutes() + " minutes.")
                    .attemptsRemaining(remaining)
                    .lockedUntil(after.isLocked(now) ? after.lockedUntil() : null)
                    .build();
        }

        // 6. Success
        IdentityRecord updated = identityService.update(phone, record -> {
            lockoutService.applySuccess(record);
            bindDevice(record, fingerprint, userAgent, now);
            record.setLastLoginAt(now);
        });

        IssuedSession session = sessionService.issue(updated.getIdentityId(), phone);
        recordAttempt(phone, ip, deviceKey, userAgent, true, AttemptReason.SUCCESS, risk.getScore(), now);

        log.info("Login succeeded for phone={} (risk score={}, action={})",
                PhoneNumbers.mask(phone), risk.getScore(), risk.getAction());

        return AuthResult.builder()
                .outcome(AuthOutcome.SUCCESS)
                .message("Login successful! Welcome back.")
                .token(session.token())
                .expiresAt(session.expiresAt())
                .user(UserView.of(updated))
                .riskScore(risk.getScore())
                .riskFlags(risk.getFlags())
                .riskAction(risk.getAction())
                .build();
    }

    static boolean isValidFormat(String mpin) {
        return mpin != null && MPIN_FORMAT.matcher(mpin).matches();
    }

    private Optional<String> decrypt(String encryptedMpin) {
        try {
            return Optional.of(transportDecryptor.decrypt(encryptedMpin));
        } catch (DecryptionException e) {
            log.debug("MPIN payload could not be decrypted");
            return Optional.empty();
        }
    }

    private static void bindDevice(IdentityRecord record, String fingerprint, String userAgent, long now) {
        if (!hasFingerprint(fingerprint)) {
            return;
        }
        Optional<DeviceBinding> existing = record.findDevice(fingerprint);
        if (existing.isPresent()) {
            existing.get().setLastUsedAt(now);
            existing.get().setUserAgent(userAgent);
        } else {
            record.getDevices().add(DeviceBinding.builder()
                    .fingerprint(fingerprint)
                    .userAgent(userAgent)
                    .lastUsedAt(now)
                    .trusted(true)
                    .build());
        }
    }

    private static boolean hasFingerprint(String fingerprint) {
        return fingerprint != null && !fingerprint.isBlank();
    }

    private void recordAttempt(String phone, String ip, String fingerprint, String userAgent,
                               boolean success, AttemptReason reason, int riskScore, long now) {
        ledgerService.record(LoginAttempt.builder()
                .phone(phone)
                .ip(ip)
                .fingerprint(hasFingerprint(fingerprint) ? fingerprint : LoginAttempt.UNKNOWN_FINGERPRINT)
                .userAgent(userAgent)
                .success(success)
                .reason(reason)
                .riskScore(riskScore)
                .timestamp(now)
                .build());
    }
}
