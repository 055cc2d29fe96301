package com.bank.mpin.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error body for rejected requests")
public record ErrorResponse(
        @Schema(description = "Error code", example = "INVALID_INPUT") String error,
        @Schema(description = "Safe, generic message", example = "Invalid phone number format") String message) {}
