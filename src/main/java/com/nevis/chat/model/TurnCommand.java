package com.nevis.chat.model;

import java.util.List;
import java.util.UUID;

public record TurnCommand(
    String userId,
    UUID threadId,
    String content,
    List<String> sources,
    String modelId,
    Double topK,
    Double temperature,
    Double maxOutputTokens,
    UUID credentialId
) {}
