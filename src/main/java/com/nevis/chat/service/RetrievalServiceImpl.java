package com.nevis.chat.service;

import com.nevis.chat.index.CorpusIndex;
import com.nevis.chat.index.IndexedPassage;
import com.nevis.chat.index.SnippetExtractor;
import com.nevis.chat.index.SourceResolver;
import com.nevis.chat.index.Tokenizer;
import com.nevis.chat.model.RetrievalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalServiceImpl implements RetrievalService {

    static final double K1 = 1.2;
    static final double B = 0.75;
    static final double TITLE_TERM_WEIGHT = 0.8;
    static final double TITLE_PHRASE_BONUS = 2.5;
    static final double BODY_PHRASE_BONUS = 1.2;

    private final CorpusIndexService corpusIndexService;

    @Override
    public List<RetrievalResult> retrieve(String query, int limit, Map<String, Double> multipliers, List<String> sources) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<String> queryTerms = List.copyOf(new LinkedHashSet<>(Tokenizer.tokenize(trimmed)));
        if (queryTerms.isEmpty()) {
            return List.of();
        }

        Set<String> sourceFilter = null;
        if (sources != null && !sources.isEmpty()) {
            sourceFilter = sources.stream()
                .map(SourceResolver::normalizeFilter)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
            if (sourceFilter.isEmpty()) {
                return List.of();
            }
        }

        CorpusIndex index = corpusIndexService.getIndex();
        String queryLower = trimmed.toLowerCase(Locale.ROOT);
        Map<String, Double> weights = multipliers == null ? Map.of() : multipliers;

        List<RetrievalResult> scored = new ArrayList<>();
        for (IndexedPassage passage : index.passages()) {
            if (sourceFilter != null && !sourceFilter.contains(passage.passage().source())) {
                continue;
            }
            RetrievalResult result = score(index, passage, queryTerms, queryLower, weights);
            if (result != null) {
                scored.add(result);
            }
        }

        // List.sort is stable, so ties keep index order.
        scored.sort(Comparator.comparingDouble(RetrievalResult::score).reversed());

        List<RetrievalResult> selected = selectDiverse(scored, limit);
        log.debug("Query '{}' matched {} passages, returning {}", trimmed, scored.size(), selected.size());
        return selected;
    }

    private RetrievalResult score(CorpusIndex index, IndexedPassage passage, List<String> queryTerms,
                                  String queryLower, Map<String, Double> weights) {
        int corpusSize = index.chunkCount();
        double lengthNorm = 1 - B + B * (passage.docLength() / index.avgDocLength());
        double score = 0;
        List<String> matchedTerms = new ArrayList<>();

        for (String term : queryTerms) {
            int tf = passage.termFrequency(term);
            if (tf <= 0) {
                continue;
            }
            int df = index.documentFrequency(term);
            double idf = Math.log(1 + (corpusSize - df + 0.5) / (df + 0.5));
            score += idf * ((tf * (K1 + 1)) / (tf + K1 * lengthNorm));
            matchedTerms.add(term);

            if (passage.titleTerms().contains(term)) {
                score += idf * TITLE_TERM_WEIGHT;
            }
        }

        if (matchedTerms.isEmpty()) {
            return null;
        }
        if (passage.searchableTitle().contains(queryLower)) {
            score += TITLE_PHRASE_BONUS;
        }
        if (passage.searchableText().contains(queryLower)) {
            score += BODY_PHRASE_BONUS;
        }

        double multiplier = weights.getOrDefault(passage.passage().chunkId(), 1.0);
        return new RetrievalResult(
            passage.passage(),
            score * multiplier,
            List.copyOf(matchedTerms),
            SnippetExtractor.extract(passage.cleanedText(), queryTerms),
            multiplier
        );
    }

    /**
     * One result per URL first, then backfill from the remaining results in score order.
     */
    static List<RetrievalResult> selectDiverse(List<RetrievalResult> sorted, int limit) {
        Set<String> seenUrls = new HashSet<>();
        List<RetrievalResult> diverse = new ArrayList<>();
        List<RetrievalResult> fallback = new ArrayList<>();

        for (RetrievalResult item : sorted) {
            if (diverse.size() < limit && seenUrls.add(item.passage().url())) {
                diverse.add(item);
            } else {
                fallback.add(item);
            }
        }

        for (RetrievalResult item : fallback) {
            if (diverse.size() >= limit) {
                break;
            }
            diverse.add(item);
        }
        return diverse;
    }
}
