package com.bank.mpin.crypto;

import com.bank.mpin.config.KeyStorageConfig;
import com.bank.mpin.exception.KeyCustodyException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Owns the RSA transport key pair.
 *
 * The pair is generated once and persisted as PEM ({@code public.pem} SPKI,
 * {@code private.pem} PKCS#8); later starts reload it. The public half is exported
 * freely. The private half is only reachable through {@link #withPrivateKey}, which
 * is package-private so only the decryptor can use it.
 */
@Component
public class KeyCustodian {

    private static final Logger log = LoggerFactory.getLogger(KeyCustodian.class);

    static final String ALGORITHM = "RSA";
    private static final String PUBLIC_LABEL = "PUBLIC KEY";
    private static final String PRIVATE_LABEL = "PRIVATE KEY";

    private final KeyStorageConfig config;

    // Written once in init(), read-only afterwards
    private volatile KeyPair keyPair;

    public KeyCustodian(KeyStorageConfig config) {
        this.config = config;
    }

    @FunctionalInterface
    interface PrivateKeyOperation<T> {
        T apply(PrivateKey privateKey) throws GeneralSecurityException;
    }

    @PostConstruct
    public void init() {
        Path directory = Paths.get(config.getDirectory());
        Path publicPath = directory.resolve(config.getPublicKeyFile());
        Path privatePath = directory.resolve(config.getPrivateKeyFile());

        if (Files.exists(publicPath) && Files.exists(privatePath)) {
            keyPair = load(publicPath, privatePath);
            log.info("RSA transport keys loaded from {}", directory.toAbsolutePath());
        } else {
            keyPair = generateAndPersist(directory, publicPath, privatePath);
            log.info("New RSA-{} transport key pair generated and saved to {}",
                    config.getKeySize(), directory.toAbsolutePath());
        }
    }

    /**
     * DER-encoded SubjectPublicKeyInfo of the transport key.
     */
    public byte[] publicKey() {
        return requireKeyPair().getPublic().getEncoded();
    }

    public String publicKeyPem() {
        return toPem(PUBLIC_LABEL, publicKey());
    }

    <T> T withPrivateKey(PrivateKeyOperation<T> operation) throws GeneralSecurityException {
        return operation.apply(requireKeyPair().getPrivate());
    }

    private KeyPair requireKeyPair() {
        KeyPair current = keyPair;
        if (current == null) {
            throw new IllegalStateException("Transport key pair not initialized");
        }
        return current;
    }

    private KeyPair load(Path publicPath, Path privatePath) {
        try {
            KeyFactory keyFactory = KeyFactory.getInstance(ALGORITHM);
            PublicKey publicKey = keyFactory.generatePublic(
                    new X509EncodedKeySpec(fromPem(Files.readString(publicPath, StandardCharsets.US_ASCII))));
            PrivateKey privateKey = keyFactory.generatePrivate(
                    new PKCS8EncodedKeySpec(fromPem(Files.readString(privatePath, StandardCharsets.US_ASCII))));
            return new KeyPair(publicKey, privateKey);
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyCustodyException("Persisted transport key pair is unreadable", e);
        }
    }

    private KeyPair generateAndPersist(Path directory, Path publicPath, Path privatePath) {
        KeyPair generated;
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(ALGORITHM);
            generator.initialize(config.getKeySize());
            generated = generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new KeyCustodyException("Unable to generate transport key pair", e);
        }

        try {
            Files.createDirectories(directory);
            Files.writeString(privatePath, toPem(PRIVATE_LABEL, generated.getPrivate().getEncoded()),
                    StandardCharsets.US_ASCII);
            restrictToOwner(privatePath);
            Files.writeString(publicPath, toPem(PUBLIC_LABEL, generated.getPublic().getEncoded()),
                    StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new KeyCustodyException("Unable to persist transport key pair", e);
        }
        return generated;
    }

    private void restrictToOwner(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.debug("File system does not support POSIX permissions for {}", path);
        }
    }

    static String toPem(String label, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + label + "-----\n" + body + "\n-----END " + label + "-----\n";
    }

    static byte[] fromPem(String pem) {
        String body = pem.replaceAll("-----(BEGIN|END) [A-Z ]+-----", "")
                .replaceAll("\\s", "");
        return Base64.getDecoder().decode(body);
    }
}
