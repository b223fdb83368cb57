package com.nevis.chat.model;

public record ConversationMessage(MessageRole role, String content) {}
