package com.bank.mpin.crypto;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Salted SHA-512 digests for MPIN storage.
 *
 * The digest is SHA-512 over {@code salt || pin}, hex encoded (128 characters).
 * Salts are 256 random bits, hex encoded.
 */
@Component
public class CredentialHasher {

    private static final String SHA_512 = "SHA-512";
    private static final int SALT_BYTES = 32;
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom = new SecureRandom();

    public String newSalt() {
        byte[] salt = new byte[SALT_BYTES];
        secureRandom.nextBytes(salt);
        return HEX.formatHex(salt);
    }

    public String hash(String pin, String salt) {
        if (pin == null || salt == null) {
            throw new IllegalArgumentException("MPIN and salt are required");
        }
        return HEX.formatHex(digest(pin, salt));
    }

    /**
     * Recomputes the digest and compares it in constant time. A stored digest that is
     * not valid hex never matches.
     */
    public boolean verify(String pin, String storedDigest, String salt) {
        if (pin == null || storedDigest == null || salt == null) {
            return false;
        }
        byte[] expected;
        try {
            expected = HEX.parseHex(storedDigest);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(digest(pin, salt), expected);
    }

    private byte[] digest(String pin, String salt) {
        try {
            MessageDigest digest = MessageDigest.getInstance(SHA_512);
            digest.update(salt.getBytes(StandardCharsets.UTF_8));
            digest.update(pin.getBytes(StandardCharsets.UTF_8));
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 algorithm not available", e);
        }
    }
}
