package com.bank.mpin.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI mpinAuthOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MPIN Authentication API")
                        .version("1.0.0")
                        .description(
                                "Phone + MPIN authentication with transport encryption and login risk scoring.\n\n" +
                                "**Login Pipeline:**\n" +
                                "1. Client fetches the RSA public key via `GET /auth/public-key`\n" +
                                "2. Client encrypts the MPIN with RSA-OAEP (SHA-256) and posts it to `/auth/login`\n" +
                                "3. Locked accounts are rejected before any credential check\n" +
                                "4. Login history is scored (0-100): **ALLOW** (<=30), **WARN** (31-60), **BLOCK** (>60)\n" +
                                "5. The MPIN is decrypted and compared with its salted SHA-512 digest\n" +
                                "6. Five wrong MPINs lock the account for 30 minutes\n\n" +
                                "**Risk Flags:**\n" +
                                "- `first_login`: no attempts in the last 30 days (+5)\n" +
                                "- `new_ip`: IP never used in a successful login (+20)\n" +
                                "- `new_device`: fingerprint never used in a successful login (+25)\n" +
                                "- `rapid_attempts`: more than 3 attempts in 5 minutes (+30)\n" +
                                "- `high_failure_rate`: more than half of recent attempts failed (+15)\n" +
                                "- `unusual_hour`: login between 02:00 and 05:59 (+10)")
                        .contact(new Contact().name("Authentication Team")));
    }
}
