package com.nevis.chat.index;

public record SourceStats(int documents, int chunks) {}
