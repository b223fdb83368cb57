package com.nevis.chat.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {

    @Nested
    @DisplayName("tokenize")
    class Tokenize {

        @Test
        void shouldLowercaseAndDropStopwordsAndShortTokens() {
            assertThat(Tokenizer.tokenize("How do I reset the SSO password for a District?"))
                .containsExactly("do", "reset", "sso", "password", "district");
        }

        @Test
        void shouldSplitOnPunctuationAndFoldAccents() {
            assertThat(Tokenizer.tokenize("Café-login: roster_sync (v2)"))
                .containsExactly("cafe", "login", "roster", "sync", "v2");
        }

        @Test
        void shouldReturnEmptyForBlankInput() {
            assertThat(Tokenizer.tokenize(null)).isEmpty();
            assertThat(Tokenizer.tokenize("   ")).isEmpty();
            assertThat(Tokenizer.tokenize("a I")).isEmpty();
        }
    }

    @Nested
    @DisplayName("clean")
    class Clean {

        @Test
        void shouldStripQuoteMarkersAndNormalizeSpacing() {
            String raw = "> Step one\r\n>Step two\n\n\n\nDone\t\tnow  ";

            assertThat(Tokenizer.clean(raw)).isEqualTo("Step one\nStep two\n\nDone now");
        }

        @Test
        void shouldTreatNullAsEmpty() {
            assertThat(Tokenizer.clean(null)).isEmpty();
        }
    }
}
