package com.bank.mpin.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Server public key for client-side MPIN encryption")
public record PublicKeyResponse(
        @Schema(description = "PEM-encoded SubjectPublicKeyInfo") String publicKey,
        @Schema(description = "Encryption the client must use", example = "RSA-OAEP-256") String algorithm) {}
