package com.bank.mpin.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Public view of an identity. Never carries credential material.")
public class UserView {

    @Schema(description = "Identity identifier", example = "0b6f1f0e-3c1d-4f5a-9b7e-2d9c8a1e4f60")
    private String identityId;

    @Schema(description = "Normalized phone number", example = "919876543210")
    private String phone;

    @Schema(description = "Display name", example = "SmartBank User")
    private String name;

    @Schema(description = "Devices bound to this identity")
    private List<DeviceBinding> devices;

    @Schema(description = "Creation time in epoch milliseconds", example = "1739886764000")
    private long createdAt;

    @Schema(description = "Last successful login in epoch milliseconds, 0 if never", example = "1739886764000")
    private long lastLoginAt;

    public static UserView of(IdentityRecord record) {
        return UserView.builder()
                .identityId(record.getIdentityId())
                .phone(record.getPhone())
                .name(record.getName())
                .devices(List.copyOf(record.getDevices()))
                .createdAt(record.getCreatedAt())
                .lastLoginAt(record.getLastLoginAt())
                .build();
    }
}
