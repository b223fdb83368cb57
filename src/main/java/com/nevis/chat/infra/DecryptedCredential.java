package com.nevis.chat.infra;

public record DecryptedCredential(String apiKey, String keyVersion, String keyId, boolean shouldReencrypt) {

    @Override
    public String toString() {
        return "DecryptedCredential[keyVersion=" + keyVersion + ", keyId=" + keyId + ", shouldReencrypt=" + shouldReencrypt + "]";
    }
}
