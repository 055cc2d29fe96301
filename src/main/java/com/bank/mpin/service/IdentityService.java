package com.bank.mpin.service;

import com.bank.mpin.config.LockoutConfig;
import com.bank.mpin.exception.StorageUnavailableException;
import com.bank.mpin.model.IdentityRecord;
import com.bank.mpin.repository.IdentityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads and atomically updates identity records.
 *
 * Updates are read-modify-write loops over the store's compare-and-swap, so
 * two requests for the same phone never lose each other's writes while
 * requests for different phones never wait on each other.
 */
@Service
public class IdentityService {

    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

    private final IdentityRepository identityRepository;
    private final LockoutConfig lockoutConfig;

    public IdentityService(IdentityRepository identityRepository, LockoutConfig lockoutConfig) {
        this.identityRepository = identityRepository;
        this.lockoutConfig = lockoutConfig;
    }

    public Optional<IdentityRecord> find(String phone) {
        return identityRepository.findByPhone(phone);
    }

    /**
     * @return false if the phone is already registered
     */
    public boolean create(IdentityRecord record) {
        return identityRepository.create(record);
    }

    /**
     * Apply {@code mutation} to the latest stored record and write it back.
     * On a concurrent write the record is re-read and the mutation re-applied.
     *
     * @return the record as written
     * @throws IllegalStateException if the identity does not exist
     * @throws StorageUnavailableException if the update keeps losing the race
     */
    public IdentityRecord update(String phone, Consumer<IdentityRecord> mutation) {
        int maxRetries = lockoutConfig.getMaxUpdateRetries();

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            IdentityRecord record = identityRepository.findByPhone(phone)
                    .orElseThrow(() -> new IllegalStateException("No identity for phone " + PhoneNumbers.mask(phone)));

            mutation.accept(record);

            if (identityRepository.updateIfUnchanged(record)) {
                return record;
            }
            log.debug("Concurrent update on identity phone={}, retry {}/{}",
                    PhoneNumbers.mask(phone), attempt, maxRetries);
        }

        log.error("Gave up updating identity phone={} after {} conflicting writes",
                PhoneNumbers.mask(phone), maxRetries);
        throw new StorageUnavailableException("Identity update did not converge after " + maxRetries + " retries");
    }
}
