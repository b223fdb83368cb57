package com.nevis.chat.listener;

import com.nevis.chat.config.CorpusProperties;
import com.nevis.chat.service.CorpusIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class CorpusIndexWarmupListener {

    private final CorpusIndexService corpusIndexService;
    private final CorpusProperties corpusProperties;

    @Async("indexTaskExecutor")
    @EventListener(ApplicationReadyEvent.class)
    public void warmIndex() {
        if (!corpusProperties.warmOnStartup()) {
            return;
        }
        log.info("Warming corpus index from {}", corpusProperties.path());
        try {
            corpusIndexService.getIndex();
        } catch (RuntimeException e) {
            // First query retries the build.
            log.error("Corpus index warm-up failed", e);
        }
    }
}
