package com.bank.mpin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "auth.keys")
public class KeyStorageConfig {

    private String directory = ".keys";
    private String publicKeyFile = "public.pem";
    private String privateKeyFile = "private.pem";
    private int keySize = 2048;
}
