package com.bank.mpin.service;

import com.bank.mpin.config.LockoutConfig;
import com.bank.mpin.model.IdentityRecord;
import com.bank.mpin.model.LockoutState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies {@link LockoutState} transitions to stored identities.
 * While locked, attempts are rejected before the credential is examined and
 * do not change the state.
 */
@Service
public class LockoutService {

    private static final Logger log = LoggerFactory.getLogger(LockoutService.class);

    private final IdentityService identityService;
    private final LockoutConfig lockoutConfig;

    public LockoutService(IdentityService identityService, LockoutConfig lockoutConfig) {
        this.identityService = identityService;
        this.lockoutConfig = lockoutConfig;
    }

    /**
     * Current lockout state for an identity. An expired lock is cleared and
     * persisted before returning.
     */
    public LockoutState check(IdentityRecord identity, long now) {
        LockoutState state = identity.lockoutState();
        if (!state.isExpiredLock(now)) {
            return state;
        }

        IdentityRecord updated = identityService.update(identity.getPhone(), record -> {
            LockoutState latest = record.lockoutState();
            if (latest.isExpiredLock(now)) {
                record.applyLockoutState(latest.expire(now));
            }
        });
        log.info("Lock expired for phone={}", PhoneNumbers.mask(identity.getPhone()));
        return updated.lockoutState();
    }

    /**
     * Count a wrong MPIN, locking the identity when the limit is reached.
     *
     * @return the state after the failure
     */
    public LockoutState recordFailure(String phone, long now) {
        IdentityRecord updated = identityService.update(phone, record -> {
            LockoutState latest = record.lockoutState();
            // A lock taken by a concurrent request stands untouched
            if (!latest.isLocked(now)) {
                record.applyLockoutState(latest.onFailure(now,
                        lockoutConfig.getMaxFailures(), lockoutConfig.getLockDurationMillis()));
            }
        });

        LockoutState after = updated.lockoutState();
        if (after.isLocked(now)) {
            log.warn("Account locked for phone={} until {}", PhoneNumbers.mask(phone), after.lockedUntil());
        }
        return after;
    }

    /**
     * Reset the failure counter. Applied inside the caller's identity update.
     */
    public void applySuccess(IdentityRecord record) {
        record.applyLockoutState(record.lockoutState().onSuccess());
    }

    public int attemptsRemaining(LockoutState state, long now) {
        return state.attemptsRemaining(now, lockoutConfig.getMaxFailures());
    }
}
