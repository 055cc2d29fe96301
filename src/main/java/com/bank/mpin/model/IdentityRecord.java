package com.bank.mpin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stored credential and lockout state for one phone number.
 *
 * Only the salted digest of the MPIN is kept. {@code generation} is the storage
 * version the record was read at and drives compare-and-swap updates.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IdentityRecord {

    public static final String DEFAULT_NAME = "SmartBank User";

    private String identityId;
    private String phone;

    @Builder.Default
    private String name = DEFAULT_NAME;

    @ToString.Exclude
    private String mpinDigest;

    @ToString.Exclude
    private String mpinSalt;

    @Builder.Default
    private List<DeviceBinding> devices = new ArrayList<>();

    private int failedAttempts;

    // Epoch millis, 0 when no lock is set
    private long lockedUntil;

    private long createdAt;
    private long lastLoginAt;

    private int generation;

    public LockoutState lockoutState() {
        return new LockoutState(failedAttempts, lockedUntil);
    }

    public void applyLockoutState(LockoutState state) {
        this.failedAttempts = state.failures();
        this.lockedUntil = state.lockedUntil();
    }

    public Optional<DeviceBinding> findDevice(String fingerprint) {
        if (fingerprint == null) return Optional.empty();
        return devices.stream()
                .filter(d -> fingerprint.equals(d.getFingerprint()))
                .findFirst();
    }

    /**
     * Deep copy, so a caller can mutate the result without touching the original.
     */
    public IdentityRecord copy() {
        List<DeviceBinding> deviceCopies = new ArrayList<>();
        for (DeviceBinding device : devices) {
            deviceCopies.add(device.toBuilder().build());
        }
        return toBuilder().devices(deviceCopies).build();
    }
}
