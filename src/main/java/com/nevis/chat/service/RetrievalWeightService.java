package com.nevis.chat.service;

import java.util.Collection;
import java.util.Map;

public interface RetrievalWeightService {

    /**
     * Chunk id to score multiplier. Chunks without a signal are absent and weigh 1.0.
     */
    Map<String, Double> multipliers();

    /**
     * Recomputes signals for the given chunks from their feedback and drops signals that no longer have ratings.
     *
     * @return how many distinct chunks were processed
     */
    int recomputeSignals(Collection<String> chunkIds);

    /**
     * Recomputes signals for every chunk that has ever been cited.
     */
    int recomputeAll();
}
