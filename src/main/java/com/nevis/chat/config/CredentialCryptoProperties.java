package com.nevis.chat.config;

import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

/**
 * Key material for personal credential encryption. {@code key} is 32 bytes as base64, base64url or hex;
 * when empty a development key derived from a fixed secret is used.
 */
@Validated
@ConfigurationProperties(prefix = "app.credentials")
public record CredentialCryptoProperties(
    @Pattern(regexp = "^[A-Za-z0-9._-]{2,64}$") @DefaultValue("local-dev") String keyId,
    String key,
    Map<String, String> keyring,
    List<String> legacySecrets
) {

    public CredentialCryptoProperties {
        keyring = keyring == null ? Map.of() : Map.copyOf(keyring);
        legacySecrets = legacySecrets == null ? List.of() : List.copyOf(legacySecrets);
    }

    @Override
    public String toString() {
        return "CredentialCryptoProperties[keyId=" + keyId + ", keyring=" + keyring.keySet() + "]";
    }
}
