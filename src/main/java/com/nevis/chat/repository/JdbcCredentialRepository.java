package com.nevis.chat.repository;

import com.nevis.chat.model.ProviderId;
import com.nevis.chat.model.UserCredential;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcCredentialRepository implements CredentialRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<UserCredential> credentialRowMapper = (rs, rowNum) -> new UserCredential(
        rs.getObject("id", UUID.class),
        rs.getString("user_id"),
        ProviderId.fromWire(rs.getString("provider")).orElseThrow(),
        rs.getString("label"),
        rs.getString("key_preview"),
        rs.getString("encrypted_key"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    public UserCredential save(UserCredential credential) {
        return jdbcClient.sql("""
                INSERT INTO user_credentials (user_id, provider, label, key_preview, encrypted_key)
                VALUES (:userId, :provider, :label, :keyPreview, :encryptedKey)
                RETURNING *
                """)
            .param("userId", credential.userId())
            .param("provider", credential.provider().wireName())
            .param("label", credential.label())
            .param("keyPreview", credential.keyPreview())
            .param("encryptedKey", credential.encryptedKey())
            .query(credentialRowMapper)
            .single();
    }

    @Override
    public Optional<UserCredential> findByIdAndUserId(UUID id, String userId) {
        return jdbcClient.sql("SELECT * FROM user_credentials WHERE id = :id AND user_id = :userId")
            .param("id", id)
            .param("userId", userId)
            .query(credentialRowMapper)
            .optional();
    }

    @Override
    public void updateEncryptedKey(UUID id, String userId, String encryptedKey, String keyPreview) {
        jdbcClient.sql("""
                UPDATE user_credentials
                SET encrypted_key = :encryptedKey,
                    key_preview = :keyPreview,
                    updated_at = NOW()
                WHERE id = :id AND user_id = :userId
                """)
            .param("encryptedKey", encryptedKey)
            .param("keyPreview", keyPreview)
            .param("id", id)
            .param("userId", userId)
            .update();
    }
}
