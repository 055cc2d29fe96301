package com.bank.mpin.repository;

import com.bank.mpin.model.LoginAttempt;

import java.util.List;

/**
 * Append-only store of login attempts. Rows older than the retention window may
 * disappear at any time, so readers must not assume a complete history.
 */
public interface LoginAttemptRepository {

    void save(LoginAttempt attempt);

    /**
     * Attempts for {@code phone} with timestamp at or after {@code since}, most recent first.
     */
    List<LoginAttempt> findRecentByPhone(String phone, long since, int limit);

    /**
     * Delete attempts older than {@code cutoff}.
     *
     * @return number of attempts removed
     */
    int purgeOlderThan(long cutoff);
}
