package com.nevis.chat.service;

import com.nevis.chat.exception.InvalidTurnRequestException;
import com.nevis.chat.infra.CredentialCipher;
import com.nevis.chat.infra.DecryptedCredential;
import com.nevis.chat.model.AuditResult;
import com.nevis.chat.model.CredentialAuditEvent;
import com.nevis.chat.model.ProviderId;
import com.nevis.chat.model.UserCredential;
import com.nevis.chat.repository.CredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialServiceImpl implements CredentialService {

    private final CredentialRepository credentialRepository;
    private final CredentialCipher credentialCipher;
    private final CredentialAuditLogger auditLogger;

    @Override
    public UserCredential register(String userId, ProviderId provider, String label, String apiKey) {
        String encrypted = credentialCipher.encrypt(apiKey);
        String trimmedLabel = label == null || label.isBlank() ? provider.wireName() + " key" : label.trim();

        UserCredential saved = credentialRepository.save(new UserCredential(
            null, userId, provider, trimmedLabel, CredentialCipher.mask(apiKey.trim()), encrypted, null));
        log.info("Stored {} credential {} for user {}", provider.wireName(), saved.id(), userId);
        return saved;
    }

    @Override
    public String resolveForTurn(String userId, UUID credentialId, ProviderId modelProvider,
                                 String modelId, String requestId) {
        UserCredential credential = credentialRepository.findByIdAndUserId(credentialId, userId).orElse(null);
        if (credential == null) {
            auditFailure(userId, credentialId, modelProvider, requestId, "invalid_user_api_key");
            throw new InvalidTurnRequestException("Selected personal key was not found.", "invalid_user_api_key");
        }

        if (credential.provider() != modelProvider) {
            auditFailure(userId, credentialId, credential.provider(), requestId, "user_api_key_provider_mismatch");
            throw new InvalidTurnRequestException(
                "Selected key is for " + credential.provider().wireName() + ", but model " + modelId
                    + " requires " + modelProvider.wireName() + ".",
                "user_api_key_provider_mismatch");
        }

        DecryptedCredential decrypted;
        try {
            decrypted = credentialCipher.decrypt(credential.encryptedKey());
        } catch (RuntimeException e) {
            auditFailure(userId, credentialId, credential.provider(), requestId, CredentialAuditLogger.reasonCodeOf(e));
            throw e;
        }

        if (decrypted.shouldReencrypt()) {
            credentialRepository.updateEncryptedKey(credentialId, userId,
                credentialCipher.encrypt(decrypted.apiKey()), CredentialCipher.mask(decrypted.apiKey()));
            log.info("Re-encrypted credential {} from {} key {} to key {}",
                credentialId, decrypted.keyVersion(), decrypted.keyId(), credentialCipher.currentKeyId());
        }
        return decrypted.apiKey();
    }

    private void auditFailure(String userId, UUID credentialId, ProviderId provider, String requestId, String reasonCode) {
        auditLogger.log(new CredentialAuditEvent(
            userId,
            CredentialAuditEvent.USE_ACTION,
            credentialId.toString(),
            provider,
            AuditResult.FAILURE,
            requestId,
            reasonCode
        ));
    }
}
