package com.nevis.chat.infra;

import com.nevis.chat.config.CredentialCryptoProperties;
import com.nevis.chat.exception.CredentialException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * AES-256-GCM encryption for stored personal credentials.
 * <p>
 * Current format: {@code v2:<keyId>:<iv>:<tag>:<ciphertext>} (base64 parts). Values in the legacy
 * {@code v1:<iv>:<tag>:<ciphertext>} format are still readable and always flagged for re-encryption.
 */
@Slf4j
@Component
public class CredentialCipher {

    static final String CURRENT_VERSION = "v2";
    static final String LEGACY_VERSION = "v1";
    static final String DEV_KEY_ID = "local-dev";
    private static final String DEV_SECRET = "chat-support-dev-user-api-keys-only";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BYTES = 16;
    private static final Pattern KEY_ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{2,64}$");
    private static final Pattern HEX_KEY = Pattern.compile("^[0-9a-fA-F]{64}$");
    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]+={0,2}$");

    private final SecureRandom random = new SecureRandom();
    private final String currentKeyId;
    private final byte[] currentKey;
    private final Map<String, byte[]> keyedDecryptors = new LinkedHashMap<>();
    private final List<byte[]> legacyDecryptors = new ArrayList<>();

    public CredentialCipher(CredentialCryptoProperties properties) {
        String keyId = properties.keyId() == null || properties.keyId().isBlank() ? DEV_KEY_ID : properties.keyId().trim();
        if (!KEY_ID_PATTERN.matcher(keyId).matches()) {
            throw new IllegalStateException("app.credentials.key-id must match " + KEY_ID_PATTERN.pattern());
        }
        this.currentKeyId = keyId;

        if (properties.key() == null || properties.key().isBlank()) {
            log.warn("No credential encryption key configured, using development key '{}'", keyId);
            this.currentKey = sha256(DEV_SECRET);
        } else {
            this.currentKey = parseKeyMaterial(properties.key(), "app.credentials.key");
        }
        keyedDecryptors.put(currentKeyId, currentKey);

        properties.keyring().forEach((ringKeyId, material) -> {
            if (!KEY_ID_PATTERN.matcher(ringKeyId).matches()) {
                throw new IllegalStateException("app.credentials.keyring ids must match " + KEY_ID_PATTERN.pattern());
            }
            if (!ringKeyId.equals(currentKeyId)) {
                keyedDecryptors.put(ringKeyId, parseKeyMaterial(material, "app.credentials.keyring"));
            }
        });

        properties.legacySecrets().stream()
            .map(String::trim)
            .filter(secret -> !secret.isEmpty())
            .map(CredentialCipher::sha256)
            .forEach(legacyDecryptors::add);
    }

    public String encrypt(String plainText) {
        String value = plainText == null ? "" : plainText.trim();
        if (value.isEmpty()) {
            throw new CredentialException("API key is required.", "missing_api_key");
        }

        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(currentKey, "AES"), new GCMParameterSpec(TAG_BYTES * 8, iv));
            byte[] sealed = cipher.doFinal(value.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext; the stored format keeps them apart.
            int cipherLength = sealed.length - TAG_BYTES;
            byte[] encrypted = new byte[cipherLength];
            byte[] tag = new byte[TAG_BYTES];
            System.arraycopy(sealed, 0, encrypted, 0, cipherLength);
            System.arraycopy(sealed, cipherLength, tag, 0, TAG_BYTES);

            Base64.Encoder encoder = Base64.getEncoder();
            return String.join(":", CURRENT_VERSION, currentKeyId,
                encoder.encodeToString(iv), encoder.encodeToString(tag), encoder.encodeToString(encrypted));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to encrypt API key", e);
        }
    }

    public DecryptedCredential decrypt(String serialized) {
        String[] parts = serialized == null ? new String[0] : serialized.split(":", -1);

        if (parts.length == 5 && CURRENT_VERSION.equals(parts[0])) {
            String keyId = parts[1].trim();
            byte[] key = KEY_ID_PATTERN.matcher(keyId).matches() ? keyedDecryptors.get(keyId) : null;
            if (key == null) {
                throw new CredentialException();
            }
            String apiKey = decryptWith(key, decodeBase64(parts[2]), decodeBase64(parts[3]), decodeBase64(parts[4]));
            return new DecryptedCredential(apiKey, CURRENT_VERSION, keyId, !keyId.equals(currentKeyId));
        }

        if (parts.length == 4 && LEGACY_VERSION.equals(parts[0])) {
            byte[] iv = decodeBase64(parts[1]);
            byte[] tag = decodeBase64(parts[2]);
            byte[] encrypted = decodeBase64(parts[3]);

            List<byte[]> candidates = new ArrayList<>();
            candidates.add(currentKey);
            candidates.addAll(keyedDecryptors.values());
            candidates.addAll(legacyDecryptors);

            for (byte[] candidate : candidates) {
                try {
                    String apiKey = decryptWith(candidate, iv, tag, encrypted);
                    return new DecryptedCredential(apiKey, LEGACY_VERSION, null, true);
                } catch (CredentialException e) {
                    log.debug("Legacy credential did not open with candidate key, trying next");
                }
            }
        }

        throw new CredentialException();
    }

    public static String mask(String apiKey) {
        String trimmed = apiKey == null ? "" : apiKey.trim();
        if (trimmed.length() <= 4) {
            return "********";
        }
        return "********" + trimmed.substring(trimmed.length() - 4);
    }

    public String currentKeyId() {
        return currentKeyId;
    }

    private String decryptWith(byte[] key, byte[] iv, byte[] tag, byte[] encrypted) {
        if (iv.length != IV_BYTES || tag.length != TAG_BYTES || encrypted.length == 0) {
            throw new CredentialException();
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BYTES * 8, iv));
            byte[] sealed = new byte[encrypted.length + TAG_BYTES];
            System.arraycopy(encrypted, 0, sealed, 0, encrypted.length);
            System.arraycopy(tag, 0, sealed, encrypted.length, TAG_BYTES);
            String value = new String(cipher.doFinal(sealed), StandardCharsets.UTF_8).trim();
            if (value.isEmpty()) {
                throw new CredentialException();
            }
            return value;
        } catch (GeneralSecurityException e) {
            throw new CredentialException(e);
        }
    }

    private static byte[] parseKeyMaterial(String raw, String propertyName) {
        String trimmed = raw.trim();
        if (HEX_KEY.matcher(trimmed).matches()) {
            return HexFormat.of().parseHex(trimmed);
        }
        String normalized = normalizeBase64(trimmed);
        if (!BASE64.matcher(normalized).matches() || normalized.length() % 4 != 0) {
            throw new IllegalStateException(propertyName + " must be a 32-byte key encoded as base64/base64url or 64-char hex");
        }
        byte[] decoded = Base64.getDecoder().decode(normalized);
        if (decoded.length != KEY_BYTES) {
            throw new IllegalStateException(propertyName + " must decode to exactly " + KEY_BYTES + " bytes");
        }
        return decoded;
    }

    private static byte[] decodeBase64(String input) {
        String normalized = normalizeBase64(input);
        if (!BASE64.matcher(normalized).matches() || normalized.length() % 4 != 0) {
            throw new CredentialException();
        }
        return Base64.getDecoder().decode(normalized);
    }

    private static String normalizeBase64(String input) {
        String value = input.trim().replace('-', '+').replace('_', '/');
        int remainder = value.length() % 4;
        return remainder == 0 ? value : value + "=".repeat(4 - remainder);
    }

    private static byte[] sha256(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
