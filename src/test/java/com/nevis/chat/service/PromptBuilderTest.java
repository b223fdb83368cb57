package com.nevis.chat.service;

import com.nevis.chat.model.ConversationMessage;
import com.nevis.chat.model.MessageRole;
import com.nevis.chat.model.Passage;
import com.nevis.chat.model.RetrievalResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    @Test
    void shouldSayNoContextWhenNothingRetrieved() {
        String prompt = PromptBuilder.systemPrompt(List.of());

        assertThat(prompt)
            .startsWith("You are a support assistant for Clever support articles.")
            .endsWith("Support article context:\nNo context found.");
    }

    @Test
    void shouldNumberContextBlocks() {
        String prompt = PromptBuilder.systemPrompt(List.of(
            TurnFixtures.result("a", 3.2), TurnFixtures.result("b", 1.1)));

        assertThat(prompt).contains(String.join("\n",
            "[1]",
            "Title: Rostering guide",
            "URL: https://support.clever.com/s/articles/a",
            "Section: Setup",
            "Heading path: Rostering > Setup",
            "Excerpt:",
            "Open the sync page to start rostering."));
        assertThat(prompt).contains("\n\n[2]\nTitle: Rostering guide\nURL: https://support.clever.com/s/articles/b");
    }

    @Test
    void shouldFillMissingSectionAndHeadingPath() {
        Passage bare = new Passage("c", "doc-c", "https://dev.clever.com/docs/c", "API basics", null, List.of(),
            "Tokens expire.", "dev.clever.com", "dev.clever.com");

        String prompt = PromptBuilder.systemPrompt(List.of(new RetrievalResult(bare, 1, List.of(), "", 1)));

        assertThat(prompt).contains("Section: (not provided)\nHeading path: API basics\n");
    }

    @Test
    void shouldKeepMostRecentMessages() {
        List<ConversationMessage> messages = IntStream.range(0, 5)
            .mapToObj(i -> new ConversationMessage(MessageRole.USER, "m" + i))
            .toList();

        assertThat(PromptBuilder.trimConversation(messages, 3))
            .extracting(ConversationMessage::content)
            .containsExactly("m2", "m3", "m4");
        assertThat(PromptBuilder.trimConversation(messages, 10)).hasSize(5);
    }
}
