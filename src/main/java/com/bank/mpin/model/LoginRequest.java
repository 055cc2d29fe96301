package com.bank.mpin.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Login with an RSA-OAEP encrypted MPIN")
public class LoginRequest {

    @Schema(description = "Phone number, any formatting; digits are kept", example = "+91 98765 43210")
    private String phone;

    @Schema(description = "Base64 RSA-OAEP(SHA-256) ciphertext of the MPIN")
    private String encryptedMpin;

    @Schema(description = "Client device fingerprint", example = "fp-7c1e9a")
    private String fingerprint;
}
