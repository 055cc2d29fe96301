package com.bank.mpin.repository;

import com.bank.mpin.model.IdentityRecord;

import java.util.Optional;

/**
 * Identity store keyed by normalized phone number.
 *
 * Implementations throw {@link com.bank.mpin.exception.StorageUnavailableException}
 * when the backing store cannot be reached.
 */
public interface IdentityRepository {

    Optional<IdentityRecord> findByPhone(String phone);

    /**
     * Insert a new identity.
     *
     * @return false if an identity with the same phone already exists; nothing is written
     */
    boolean create(IdentityRecord record);

    /**
     * Compare-and-swap write: succeeds only if the stored record is still at
     * {@code record.getGeneration()}. On success the record's generation is advanced.
     *
     * @return false if another writer got there first
     */
    boolean updateIfUnchanged(IdentityRecord record);
}
