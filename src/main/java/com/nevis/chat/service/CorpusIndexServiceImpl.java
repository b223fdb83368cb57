package com.nevis.chat.service;

import com.nevis.chat.index.CorpusIndex;
import com.nevis.chat.model.Passage;
import com.nevis.chat.repository.PassageSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusIndexServiceImpl implements CorpusIndexService {

    private final PassageSource passageSource;

    private final AtomicReference<CompletableFuture<CorpusIndex>> current = new AtomicReference<>();
    private final AtomicInteger buildCount = new AtomicInteger();
    private volatile Long lastBuildMs;

    @Override
    public CorpusIndex getIndex() {
        CompletableFuture<CorpusIndex> inFlight = current.get();
        if (inFlight == null) {
            CompletableFuture<CorpusIndex> created = new CompletableFuture<>();
            if (current.compareAndSet(null, created)) {
                build(created);
                inFlight = created;
            } else {
                inFlight = current.get();
            }
        }
        return await(inFlight);
    }

    @Override
    public CorpusIndex rebuild() {
        CompletableFuture<CorpusIndex> next = new CompletableFuture<>();
        boolean publishedEarly = current.compareAndSet(null, next);
        build(next);
        CorpusIndex index = await(next);
        if (!publishedEarly) {
            current.set(next);
        }
        return index;
    }

    @Override
    public IndexDiagnostics diagnostics() {
        CompletableFuture<CorpusIndex> future = current.get();
        CorpusIndex index = future != null && future.isDone() && !future.isCompletedExceptionally()
            ? future.join()
            : null;

        if (index == null) {
            return new IndexDiagnostics(false, buildCount.get(), lastBuildMs, null, 0, 0, passageSource.location(), Map.of());
        }
        return new IndexDiagnostics(
            true,
            buildCount.get(),
            lastBuildMs,
            index.builtAt(),
            index.chunkCount(),
            index.articleCount(),
            index.corpusPath(),
            index.perSource()
        );
    }

    @Override
    public CorpusStats stats() {
        CorpusIndex index = getIndex();
        return new CorpusStats(index.articleCount(), index.chunkCount(), index.corpusPath());
    }

    private void build(CompletableFuture<CorpusIndex> target) {
        long started = System.nanoTime();
        try {
            List<Passage> records = passageSource.loadAll();
            CorpusIndex index = CorpusIndex.build(records, passageSource.location());

            lastBuildMs = (System.nanoTime() - started) / 1_000_000;
            int count = buildCount.incrementAndGet();
            log.info("Corpus index #{} built: {} chunks from {} articles ({} records read) in {} ms",
                count, index.chunkCount(), index.articleCount(), records.size(), lastBuildMs);

            target.complete(index);
        } catch (RuntimeException e) {
            log.error("Corpus index build failed for {}", passageSource.location(), e);
            current.compareAndSet(target, null);
            target.completeExceptionally(e);
        }
    }

    private static CorpusIndex await(CompletableFuture<CorpusIndex> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
