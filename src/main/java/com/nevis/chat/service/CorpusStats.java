package com.nevis.chat.service;

public record CorpusStats(int articleCount, int chunkCount, String corpusPath) {}
