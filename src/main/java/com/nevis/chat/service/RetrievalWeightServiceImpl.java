package com.nevis.chat.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.nevis.chat.config.RetrievalProperties;
import com.nevis.chat.repository.RatingAggregate;
import com.nevis.chat.repository.RetrievalSignal;
import com.nevis.chat.repository.RetrievalSignalRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class RetrievalWeightServiceImpl implements RetrievalWeightService {

    static final double MAX_MULTIPLIER = 1.2;
    static final double MIN_MULTIPLIER = 0.7;
    static final int STRONG_SIGNAL_THRESHOLD = 8;
    static final int LIGHT_SIGNAL_THRESHOLD = 3;

    private static final String ALL_SIGNALS = "all";

    private final RetrievalSignalRepository signalRepository;
    private final LoadingCache<String, Map<String, Double>> weightsCache;

    public RetrievalWeightServiceImpl(RetrievalSignalRepository signalRepository, RetrievalProperties properties) {
        this.signalRepository = signalRepository;
        this.weightsCache = Caffeine.newBuilder()
            .expireAfterWrite(properties.signalCacheTtl())
            .maximumSize(1)
            .build(key -> loadWeights());
    }

    /**
     * Neutral at an average of 3, scaled down for small samples, then clamped to [0.7, 1.2].
     */
    public static RetrievalSignal calculateMultiplier(String chunkId, double avgRating, int ratingCount,
                                                      int lowCount, int highCount) {
        int count = Math.max(0, ratingCount);
        if (count == 0) {
            return new RetrievalSignal(chunkId, 1.0, 0, 0, 0, 0);
        }

        double avg = clamp(avgRating, 1, 5);
        int low = Math.max(0, Math.min(count, lowCount));
        int high = Math.max(0, Math.min(count, highCount));

        double confidence = Math.min(1.0, (double) count / STRONG_SIGNAL_THRESHOLD);
        if (count < LIGHT_SIGNAL_THRESHOLD) {
            confidence *= 0.5;
        }

        double baseFromAvg = ((avg - 3) / 2) * 0.2;
        double lowPenalty = ((double) low / count) * 0.18;
        double highBoost = ((double) high / count) * 0.08;
        double adjustment = (baseFromAvg - lowPenalty + highBoost) * confidence;

        double multiplier = round4(clamp(1 + adjustment, MIN_MULTIPLIER, MAX_MULTIPLIER));
        return new RetrievalSignal(chunkId, multiplier, avg, count, low, high);
    }

    @Override
    public Map<String, Double> multipliers() {
        return weightsCache.get(ALL_SIGNALS);
    }

    private Map<String, Double> loadWeights() {
        return signalRepository.findAll().stream()
            .collect(Collectors.toUnmodifiableMap(RetrievalSignal::chunkId, RetrievalSignal::multiplier));
    }

    @Override
    @Transactional
    public int recomputeSignals(Collection<String> chunkIds) {
        Set<String> unique = chunkIds.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(id -> !id.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (unique.isEmpty()) {
            return 0;
        }

        Map<String, RatingAggregate> aggregates = signalRepository.aggregateRatings(unique).stream()
            .collect(Collectors.toMap(RatingAggregate::chunkId, Function.identity()));

        int updated = 0;
        for (String chunkId : unique) {
            RatingAggregate aggregate = aggregates.get(chunkId);
            if (aggregate == null || aggregate.ratingCount() == 0) {
                signalRepository.delete(chunkId);
                continue;
            }
            signalRepository.upsert(calculateMultiplier(
                chunkId,
                aggregate.averageRating(),
                aggregate.ratingCount(),
                aggregate.lowCount(),
                aggregate.highCount()
            ));
            updated++;
        }

        weightsCache.invalidateAll();
        log.info("Recomputed retrieval signals for {} chunks ({} weighted, {} cleared)",
            unique.size(), updated, unique.size() - updated);
        return unique.size();
    }

    @Override
    @Transactional
    public int recomputeAll() {
        List<String> cited = signalRepository.findCitedChunkIds();
        return recomputeSignals(cited);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round4(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
