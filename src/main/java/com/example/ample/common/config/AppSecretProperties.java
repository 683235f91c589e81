package com.example.ample.common.config;

import javax.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.secrets")
public class AppSecretProperties {

    /**
     * Properties file holding the sealed entries.
     */
    @NotBlank
    private String storePath = System.getProperty("user.home") + "/.config/ample/secrets.properties";

    /**
     * Passphrase the entries are sealed with.
     */
    @NotBlank
    private String encryptKey = "ample-local-secret-store";
}
