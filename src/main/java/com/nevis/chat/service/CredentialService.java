package com.nevis.chat.service;

import com.nevis.chat.model.ProviderId;
import com.nevis.chat.model.UserCredential;

import java.util.UUID;

public interface CredentialService {

    /**
     * Encrypts and stores a personal provider key.
     */
    UserCredential register(String userId, ProviderId provider, String label, String apiKey);

    /**
     * Decrypts the caller's stored key for use in one turn. Every failure is audited before it is thrown,
     * and keys sealed under a retired key version are re-encrypted in place.
     *
     * @return the plaintext provider key
     */
    String resolveForTurn(String userId, UUID credentialId, ProviderId modelProvider, String modelId, String requestId);
}
