package com.bank.mpin.crypto;

import com.bank.mpin.config.KeyStorageConfig;
import com.bank.mpin.exception.DecryptionException;
import com.bank.mpin.testutil.ClientEncryption;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransportDecryptorTest {

    @TempDir
    static Path keyDir;

    private static KeyCustodian custodian;
    private static TransportDecryptor decryptor;

    @BeforeAll
    static void setUp() {
        KeyStorageConfig config = new KeyStorageConfig();
        config.setDirectory(keyDir.toString());
        custodian = new KeyCustodian(config);
        custodian.init();
        decryptor = new TransportDecryptor(custodian);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1234", "000000", "987654"})
    void decrypt_clientCiphertext_returnsPin(String pin) throws Exception {
        String ciphertext = ClientEncryption.encrypt(custodian.publicKey(), pin);

        assertThat(decryptor.decrypt(ciphertext)).isEqualTo(pin);
    }

    @Test
    void decrypt_sameMpinTwice_ciphertextsDiffer() throws Exception {
        String first = ClientEncryption.encrypt(custodian.publicKey(), "1234");
        String second = ClientEncryption.encrypt(custodian.publicKey(), "1234");

        assertThat(first).isNotEqualTo(second);
        assertThat(decryptor.decrypt(first)).isEqualTo(decryptor.decrypt(second));
    }

    @Test
    void decrypt_malformedBase64_throwsGenericError() {
        assertThatThrownBy(() -> decryptor.decrypt("%%% not base64 %%%"))
                .isInstanceOf(DecryptionException.class)
                .hasMessage(DecryptionException.GENERIC_MESSAGE);
    }

    @Test
    void decrypt_tamperedCiphertext_throwsGenericError() {
        byte[] bytes = Base64.getDecoder().decode(ClientEncryption.encrypt(custodian.publicKey(), "1234"));
        bytes[bytes.length / 2] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(bytes);

        assertThatThrownBy(() -> decryptor.decrypt(tampered))
                .isInstanceOf(DecryptionException.class)
                .hasMessage(DecryptionException.GENERIC_MESSAGE);
    }

    @Test
    void decrypt_wrongLength_throwsGenericError() {
        String shortCiphertext = Base64.getEncoder().encodeToString(new byte[16]);

        assertThatThrownBy(() -> decryptor.decrypt(shortCiphertext))
                .isInstanceOf(DecryptionException.class)
                .hasMessage(DecryptionException.GENERIC_MESSAGE);
    }

    @Test
    void decrypt_blank_throwsGenericError() {
        assertThatThrownBy(() -> decryptor.decrypt(" "))
                .isInstanceOf(DecryptionException.class)
                .hasMessage(DecryptionException.GENERIC_MESSAGE);
        assertThatThrownBy(() -> decryptor.decrypt(null))
                .isInstanceOf(DecryptionException.class);
    }
}
