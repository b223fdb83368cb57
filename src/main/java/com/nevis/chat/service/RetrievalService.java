package com.nevis.chat.service;

import com.nevis.chat.model.RetrievalResult;

import java.util.List;
import java.util.Map;

public interface RetrievalService {

    /**
     * Ranks indexed passages against {@code query}.
     *
     * @param multipliers per-chunk score weights, 1.0 when absent
     * @param sources     optional source filter; {@code null} or empty means no filter
     */
    List<RetrievalResult> retrieve(String query, int limit, Map<String, Double> multipliers, List<String> sources);
}
