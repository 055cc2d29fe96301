package com.bank.mpin.crypto;

import com.bank.mpin.exception.DecryptionException;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.spec.MGF1ParameterSpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Decrypts MPIN payloads that clients encrypted with the transport public key.
 *
 * Padding is RSA-OAEP with SHA-256 for both the digest and MGF1, which is what
 * WebCrypto's {@code RSA-OAEP} with {@code SHA-256} produces. Every failure surfaces
 * as the same {@link DecryptionException}.
 */
@Component
public class TransportDecryptor {

    static final String TRANSFORMATION = "RSA/ECB/OAEPPadding";
    static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
            "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    private final KeyCustodian keyCustodian;

    public TransportDecryptor(KeyCustodian keyCustodian) {
        this.keyCustodian = keyCustodian;
    }

    public String decrypt(String ciphertextBase64) throws DecryptionException {
        if (ciphertextBase64 == null || ciphertextBase64.isBlank()) {
            throw new DecryptionException(null);
        }

        byte[] plaintext = null;
        try {
            byte[] ciphertext = Base64.getDecoder().decode(ciphertextBase64.trim());
            plaintext = keyCustodian.withPrivateKey(privateKey -> {
                Cipher cipher = Cipher.getInstance(TRANSFORMATION);
                cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA256);
                return cipher.doFinal(ciphertext);
            });
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new DecryptionException(e);
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }
}
