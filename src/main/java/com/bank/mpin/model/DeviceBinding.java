package com.bank.mpin.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A client device that has successfully authenticated for an identity")
public class DeviceBinding {

    @Schema(description = "Stable client fingerprint", example = "fp-7c1e9a")
    private String fingerprint;

    @Schema(description = "Last user-agent seen from this device", example = "Mozilla/5.0 (Linux; Android 14)")
    private String userAgent;

    @Schema(description = "Last successful use in epoch milliseconds", example = "1739886764000")
    private long lastUsedAt;

    @Schema(description = "Whether the device is trusted", example = "true")
    private boolean trusted;
}
