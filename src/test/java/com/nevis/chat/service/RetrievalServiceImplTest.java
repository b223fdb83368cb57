package com.nevis.chat.service;

import com.nevis.chat.index.CorpusIndex;
import com.nevis.chat.model.Passage;
import com.nevis.chat.model.RetrievalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RetrievalServiceImplTest {

    private static final String GUIDE_URL = "https://support.clever.com/hc/articles/rostering-setup";
    private static final String SYNC_URL = "https://support.clever.com/hc/articles/sync-schedule";
    private static final String BADGE_URL = "https://dev.clever.com/docs/badges";

    @Mock
    private CorpusIndexService corpusIndexService;

    @InjectMocks
    private RetrievalServiceImpl retrievalService;

    static Passage passage(String chunkId, String url, String title, String text) {
        return new Passage(chunkId, url, url, title, null, List.of(), text, null, null);
    }

    @BeforeEach
    void setUp() {
        when(corpusIndexService.getIndex()).thenReturn(CorpusIndex.build(List.of(
            passage("guide-1", GUIDE_URL, "Rostering setup guide",
                "How to set up rostering for your district. Rostering setup takes minutes."),
            passage("guide-2", GUIDE_URL, "Rostering setup guide",
                "Troubleshoot rostering errors when setup fails."),
            passage("badge-1", BADGE_URL, "Badge login", "Badges let students log in."),
            passage("sync-1", SYNC_URL, "Sync schedule", "Rostering sync runs nightly.")
        ), "memory"));
    }

    @Nested
    @DisplayName("ranking")
    class Ranking {

        @Test
        void shouldRankPhraseAndTitleMatchFirst() {
            List<RetrievalResult> results = retrievalService.retrieve("rostering setup", 2, Map.of(), null);

            assertThat(results).extracting(r -> r.passage().chunkId()).containsExactly("guide-1", "sync-1");
            assertThat(results.get(0).matchedTerms()).containsExactly("rostering", "setup");
            assertThat(results.get(0).multiplierApplied()).isEqualTo(1.0);
            assertThat(results.get(0).snippet()).contains("rostering");
            assertThat(results.get(0).score()).isGreaterThan(results.get(1).score());
        }

        @Test
        void shouldBackfillSameArticleWhenDistinctUrlsRunOut() {
            List<RetrievalResult> results = retrievalService.retrieve("rostering setup", 5, Map.of(), null);

            assertThat(results).extracting(r -> r.passage().chunkId()).containsExactly("guide-1", "sync-1", "guide-2");
        }

        @Test
        void shouldApplyMultiplierToFinalScore() {
            List<RetrievalResult> results = retrievalService.retrieve("rostering setup", 3, Map.of("guide-1", 0.5), null);

            assertThat(results.get(0).passage().chunkId()).isEqualTo("guide-2");
            RetrievalResult demoted = results.stream()
                .filter(r -> r.passage().chunkId().equals("guide-1"))
                .findFirst()
                .orElseThrow();
            assertThat(demoted.multiplierApplied()).isEqualTo(0.5);
        }

        @Test
        void shouldReturnSameOrderOnRepeatedQueries() {
            List<RetrievalResult> first = retrievalService.retrieve("rostering", 4, Map.of(), null);
            List<RetrievalResult> second = retrievalService.retrieve("rostering", 4, Map.of(), null);

            assertThat(second).isEqualTo(first);
        }

        @Test
        void shouldReturnOnlyMatchingPassageWithSnippetAroundFirstHit() {
            String text = "district dashboard overview ".repeat(10)
                + "rostering setup begins here. rostering again later.";
            when(corpusIndexService.getIndex()).thenReturn(CorpusIndex.build(List.of(
                passage("a", GUIDE_URL, "District guide", text),
                passage("b", BADGE_URL, "Badge login", "Badges let students log in."),
                passage("c", SYNC_URL, "Sync schedule", "Sync runs nightly for your district.")
            ), "memory"));

            List<RetrievalResult> results = retrievalService.retrieve("rostering setup", 6, Map.of(), null);

            assertThat(results).extracting(r -> r.passage().chunkId()).containsExactly("a");
            String snippet = results.get(0).snippet();
            assertThat(snippet).isEqualTo("..." + text.substring(text.indexOf("rostering") - 90));
            assertThat(snippet.indexOf("rostering")).isEqualTo(3 + 90);
        }
    }

    @Nested
    @DisplayName("source filter")
    class SourceFilter {

        @Test
        void shouldRestrictToRequestedSource() {
            List<RetrievalResult> results = retrievalService.retrieve("badges students", 5, Map.of(), List.of("DEV.clever.com"));

            assertThat(results).extracting(r -> r.passage().chunkId()).containsExactly("badge-1");
        }

        @Test
        void shouldTreatEmptyListAsNoFilter() {
            List<RetrievalResult> results = retrievalService.retrieve("rostering", 5, Map.of(), List.of());

            assertThat(results).hasSize(3);
        }

        @Test
        void shouldMatchNothingWhenAllFilterValuesAreBlank() {
            assertThat(retrievalService.retrieve("rostering", 5, Map.of(), List.of(" ", ""))).isEmpty();
            verifyNoInteractions(corpusIndexService);
        }
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "the and of", "?!"})
    void shouldReturnNothingForQueriesWithoutTerms(String query) {
        assertThat(retrievalService.retrieve(query, 5, Map.of(), null)).isEmpty();
        verifyNoInteractions(corpusIndexService);
    }

    @Test
    void shouldReturnNothingForNonPositiveLimit() {
        assertThat(retrievalService.retrieve("rostering", 0, Map.of(), null)).isEmpty();
    }
}
