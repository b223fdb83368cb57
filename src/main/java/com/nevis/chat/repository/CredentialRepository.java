package com.nevis.chat.repository;

import com.nevis.chat.model.UserCredential;

import java.util.Optional;
import java.util.UUID;

public interface CredentialRepository {

    UserCredential save(UserCredential credential);

    Optional<UserCredential> findByIdAndUserId(UUID id, String userId);

    void updateEncryptedKey(UUID id, String userId, String encryptedKey, String keyPreview);
}
