package com.bank.mpin.model;

/**
 * Lockout state machine for one identity.
 *
 * <pre>
 *   Unlocked(n) --failure--> Unlocked(n+1)         while n+1 &lt; maxFailures
 *   Unlocked(n) --failure--> Locked(now+duration)  failures reset to 0
 *   Unlocked(n) --success--> Unlocked(0)
 *   Locked(t)   --check, now &gt;= t--> Unlocked(0)
 * </pre>
 *
 * A lock and its failure reset always change in the same transition.
 */
public record LockoutState(int failures, long lockedUntil) {

    public static final LockoutState INITIAL = new LockoutState(0, 0L);

    public boolean isLocked(long now) {
        return lockedUntil > 0 && now < lockedUntil;
    }

    /**
     * True when a lock was set but has already run out and the state still needs clearing.
     */
    public boolean isExpiredLock(long now) {
        return lockedUntil > 0 && now >= lockedUntil;
    }

    public LockoutState expire(long now) {
        return isExpiredLock(now) ? INITIAL : this;
    }

    public LockoutState onFailure(long now, int maxFailures, long lockDurationMillis) {
        LockoutState current = expire(now);
        int next = current.failures + 1;
        if (next >= maxFailures) {
            return new LockoutState(0, now + lockDurationMillis);
        }
        return new LockoutState(next, 0L);
    }

    public LockoutState onSuccess() {
        return INITIAL;
    }

    public int attemptsRemaining(long now, int maxFailures) {
        if (isLocked(now)) return 0;
        return Math.max(0, maxFailures - failures);
    }
}
