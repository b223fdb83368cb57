package com.nevis.chat.repository;

import java.util.Map;

public interface AuditLogRepository {

    void save(String actorUserId, String action, String targetType, String targetId, Map<String, Object> metadata);

    int countByActionAndTarget(String action, String targetId);
}
