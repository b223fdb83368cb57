package com.nevis.chat.infra;

import com.nevis.chat.config.ProviderProperties;
import com.nevis.chat.model.ConversationMessage;
import com.nevis.chat.model.MessageRole;
import com.nevis.chat.model.ModelSpec;
import com.nevis.chat.model.ProviderId;
import com.nevis.chat.model.ProviderRequest;
import com.nevis.chat.model.ProviderResponse;
import com.nevis.chat.model.UsageMetrics;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LangChainProviderClientTest {

    private static final ModelSpec MODEL = ModelSpec.standard(ProviderId.OPENAI, "gpt-5-mini", "GPT-5 mini", 0.25, 2);

    @Mock
    private ChatModelFactory chatModelFactory;

    @Mock
    private ChatModel chatModel;

    private LangChainProviderClient client;

    @BeforeEach
    void setUp() {
        ProviderProperties properties = new ProviderProperties("sk-house", null, null,
            "https://api.openai.com/v1", "https://api.anthropic.com", "https://generativelanguage.googleapis.com/v1beta",
            Duration.ofSeconds(60), 2, false, false, Duration.ofSeconds(7), Duration.ofMinutes(5));
        client = new LangChainProviderClient(chatModelFactory, properties);
    }

    private static ProviderRequest request(ModelSpec model, String override) {
        return new ProviderRequest(model,
            List.of(new ConversationMessage(MessageRole.USER, "How do I sync?"),
                new ConversationMessage(MessageRole.ASSISTANT, "Open the dashboard."),
                new ConversationMessage(MessageRole.USER, "And then?")),
            "System prompt", 0.2, 800, override);
    }

    @Test
    void shouldSendSystemPromptAndHistoryInOrder() {
        when(chatModelFactory.create(MODEL, "sk-house", 0.2, 800)).thenReturn(chatModel);
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
            .aiMessage(AiMessage.from("  Click sync.  "))
            .tokenUsage(new TokenUsage(120, 30))
            .build());

        ProviderResponse response = client.chat(request(MODEL, null));

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        List<ChatMessage> sent = captor.getValue().messages();
        assertThat(sent).hasSize(4);
        assertThat(((SystemMessage) sent.get(0)).text()).isEqualTo("System prompt");
        assertThat(((UserMessage) sent.get(1)).singleText()).isEqualTo("How do I sync?");
        assertThat(((AiMessage) sent.get(2)).text()).isEqualTo("Open the dashboard.");

        assertThat(response.text()).isEqualTo("Click sync.");
        assertThat(response.modelId()).isEqualTo("openai:gpt-5-mini");
        assertThat(response.usage()).isEqualTo(new UsageMetrics(120, 30, 150));
    }

    @Test
    void shouldPreferPersonalKey() {
        when(chatModelFactory.create(eq(MODEL), eq("sk-personal"), anyDouble(), anyInt())).thenReturn(chatModel);
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
            .aiMessage(AiMessage.from("ok"))
            .build());

        client.chat(request(MODEL, " sk-personal "));

        verify(chatModelFactory).create(eq(MODEL), eq("sk-personal"), anyDouble(), anyInt());
    }

    @Test
    void shouldFailWithoutAnyKey() {
        ModelSpec gemini = ModelSpec.standard(ProviderId.GEMINI, "gemini-2.5-flash", "Gemini 2.5 Flash", 0.3, 2.5);

        assertThatThrownBy(() -> client.chat(request(gemini, null)))
            .isInstanceOf(IllegalStateException.class);
        verify(chatModelFactory, never()).create(any(), anyString(), anyDouble(), anyInt());
    }

    @Test
    void shouldEstimateMissingUsage() {
        UsageMetrics usage = LangChainProviderClient.normalizeUsage(null, "x".repeat(40), "y".repeat(9));

        assertThat(usage).isEqualTo(new UsageMetrics(10, 3, 13));
    }

    @Test
    void shouldKeepPartialReportedUsage() {
        UsageMetrics usage = LangChainProviderClient.normalizeUsage(new TokenUsage(50, null, null), "prompt", "y".repeat(8));

        assertThat(usage).isEqualTo(new UsageMetrics(50, 2, 52));
    }
}
