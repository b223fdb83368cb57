package com.nevis.chat.index;

import com.nevis.chat.model.Passage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable inverted index over one corpus snapshot. Safe to share across threads once built.
 */
public final class CorpusIndex {

    private final List<IndexedPassage> passages;
    private final Map<String, Integer> docFreq;
    private final double avgDocLength;
    private final int articleCount;
    private final Map<String, SourceStats> perSource;
    private final String corpusPath;
    private final Instant builtAt;

    private CorpusIndex(List<IndexedPassage> passages, Map<String, Integer> docFreq, double avgDocLength,
                        int articleCount, Map<String, SourceStats> perSource, String corpusPath, Instant builtAt) {
        this.passages = List.copyOf(passages);
        this.docFreq = Map.copyOf(docFreq);
        this.avgDocLength = avgDocLength;
        this.articleCount = articleCount;
        this.perSource = Map.copyOf(perSource);
        this.corpusPath = corpusPath;
        this.builtAt = builtAt;
    }

    public static CorpusIndex build(List<Passage> records, String corpusPath) {
        List<IndexedPassage> indexed = new ArrayList<>(records.size());
        Map<String, Integer> docFreq = new HashMap<>();
        Set<String> articleIds = new HashSet<>();
        Map<String, Set<String>> docsBySource = new TreeMap<>();
        Map<String, Integer> chunksBySource = new TreeMap<>();
        long totalDocLength = 0;

        for (Passage record : records) {
            if (isBlank(record.chunkId()) || isBlank(record.url()) || isBlank(record.title()) || isBlank(record.text())) {
                continue;
            }

            Passage passage = resolveSource(record);
            String cleanedText = Tokenizer.clean(passage.text());
            String section = passage.section() == null ? "" : passage.section();
            List<String> terms = Tokenizer.tokenize(passage.title() + "\n" + section + "\n" + cleanedText);

            Map<String, Integer> termFreq = new HashMap<>();
            terms.forEach(term -> termFreq.merge(term, 1, Integer::sum));
            termFreq.keySet().forEach(term -> docFreq.merge(term, 1, Integer::sum));

            int docLength = Math.max(1, terms.size());
            totalDocLength += docLength;

            String docKey = passage.docId() == null ? passage.chunkId() : passage.docId();
            articleIds.add(docKey);
            docsBySource.computeIfAbsent(passage.source(), s -> new HashSet<>()).add(docKey);
            chunksBySource.merge(passage.source(), 1, Integer::sum);

            indexed.add(new IndexedPassage(
                passage,
                cleanedText,
                passage.title().toLowerCase(Locale.ROOT),
                cleanedText.toLowerCase(Locale.ROOT),
                Map.copyOf(termFreq),
                docLength,
                new LinkedHashSet<>(Tokenizer.tokenize(passage.title()))
            ));
        }

        double avgDocLength = Math.max(1.0, (double) totalDocLength / Math.max(1, indexed.size()));

        Map<String, SourceStats> perSource = new TreeMap<>();
        chunksBySource.forEach((source, chunks) ->
            perSource.put(source, new SourceStats(docsBySource.get(source).size(), chunks)));

        return new CorpusIndex(indexed, docFreq, avgDocLength, articleIds.size(), perSource, corpusPath, Instant.now());
    }

    private static Passage resolveSource(Passage record) {
        return new Passage(
            record.chunkId(),
            record.docId(),
            record.url(),
            record.title(),
            record.section(),
            record.headingPath() == null ? List.of() : record.headingPath(),
            record.text(),
            SourceResolver.resolveSource(record.source(), record.url()),
            SourceResolver.resolveHost(record.sourceHost(), record.url())
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    public List<IndexedPassage> passages() {
        return passages;
    }

    public int documentFrequency(String term) {
        return docFreq.getOrDefault(term, 0);
    }

    public double avgDocLength() {
        return avgDocLength;
    }

    public int chunkCount() {
        return passages.size();
    }

    public int articleCount() {
        return articleCount;
    }

    public Map<String, SourceStats> perSource() {
        return perSource;
    }

    public String corpusPath() {
        return corpusPath;
    }

    public Instant builtAt() {
        return builtAt;
    }
}
