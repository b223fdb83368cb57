package com.nevis.chat.service;

import com.nevis.chat.model.ConversationMessage;
import com.nevis.chat.model.Passage;
import com.nevis.chat.model.RetrievalResult;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the grounding instruction sent with every turn.
 */
public final class PromptBuilder {

    private static final String INSTRUCTIONS = String.join("\n",
        "You are a support assistant for Clever support articles.",
        "Answer only using the supplied context excerpts.",
        "If the context is incomplete, say what is missing and suggest the closest supported next step.",
        "Never invent product behavior or policy.",
        "Cite supporting excerpts inline using [1], [2], etc.",
        "End each answer with a short 'Sources' section listing the citation numbers and URLs.",
        "",
        "Support article context:"
    );

    private PromptBuilder() {
    }

    public static String systemPrompt(List<RetrievalResult> contexts) {
        if (contexts.isEmpty()) {
            return INSTRUCTIONS + "\n" + "No context found.";
        }

        List<String> sections = new ArrayList<>();
        for (int i = 0; i < contexts.size(); i++) {
            sections.add(contextBlock(i + 1, contexts.get(i).passage()));
        }
        return INSTRUCTIONS + "\n" + String.join("\n\n", sections);
    }

    /**
     * Keeps the last {@code maxMessages} messages.
     */
    public static List<ConversationMessage> trimConversation(List<ConversationMessage> messages, int maxMessages) {
        if (messages.size() <= maxMessages) {
            return List.copyOf(messages);
        }
        return List.copyOf(messages.subList(messages.size() - maxMessages, messages.size()));
    }

    private static String contextBlock(int number, Passage passage) {
        String headingPath = passage.headingPath() == null || passage.headingPath().isEmpty()
            ? passage.title()
            : passage.headingPath().stream().collect(Collectors.joining(" > "));
        String section = passage.section() == null || passage.section().isBlank() ? "(not provided)" : passage.section();

        return String.join("\n",
            "[" + number + "]",
            "Title: " + passage.title(),
            "URL: " + passage.url(),
            "Section: " + section,
            "Heading path: " + headingPath,
            "Excerpt:\n" + passage.text()
        );
    }
}
