package com.bank.mpin.service;

import com.bank.mpin.config.LedgerConfig;
import com.bank.mpin.config.MetricsConfig;
import com.bank.mpin.model.LoginAttempt;
import com.bank.mpin.repository.LoginAttemptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Append-only ledger of login attempts feeding the risk scorer.
 *
 * Writes never fail the caller: a store error is logged and counted. Reads
 * propagate store errors so the scorer can fall back.
 */
@Service
public class AttemptLedgerService {

    private static final Logger log = LoggerFactory.getLogger(AttemptLedgerService.class);

    private final LoginAttemptRepository attemptRepository;
    private final LedgerConfig ledgerConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AttemptLedgerService(LoginAttemptRepository attemptRepository,
                                LedgerConfig ledgerConfig,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.attemptRepository = attemptRepository;
        this.ledgerConfig = ledgerConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public void record(LoginAttempt attempt) {
        if (attempt.getAttemptId() == null) {
            attempt.setAttemptId(UUID.randomUUID().toString());
        }
        if (attempt.getFingerprint() == null) {
            attempt.setFingerprint(LoginAttempt.UNKNOWN_FINGERPRINT);
        }
        if (attempt.getUserAgent() == null) {
            attempt.setUserAgent("");
        }

        try {
            attemptRepository.save(attempt);
        } catch (RuntimeException e) {
            metricsConfig.recordLedgerWriteFailure();
            log.error("Failed to record login attempt for phone={} reason={}: {}",
                    PhoneNumbers.mask(attempt.getPhone()), attempt.getReason(), e.getMessage(), e);
        }
    }

    /**
     * Attempts since {@code since}, most recent first, at most {@code limit}.
     */
    public List<LoginAttempt> recentFor(String phone, long since, int limit) {
        return attemptRepository.findRecentByPhone(phone, since, limit);
    }

    /**
     * Audit view of everything still retained for an identity.
     */
    public List<LoginAttempt> history(String phone, int limit) {
        return recentFor(phone, clock.millis() - ledgerConfig.getRetentionMillis(), limit);
    }

    @Scheduled(fixedRateString = "${auth.ledger.purge-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "5")
    public void purgeExpired() {
        long cutoff = clock.millis() - ledgerConfig.getRetentionMillis();
        try {
            int purged = attemptRepository.purgeOlderThan(cutoff);
            if (purged > 0) {
                log.info("Purged {} login attempts older than {} days", purged, ledgerConfig.getRetentionDays());
                metricsConfig.recordLedgerPurged(purged);
            }
        } catch (RuntimeException e) {
            log.error("Login attempt purge failed: {}", e.getMessage(), e);
        }
    }
}
