package com.nevis.chat.controller;

import com.nevis.chat.exception.ForbiddenException;
import com.nevis.chat.exception.InsufficientBalanceException;
import com.nevis.chat.exception.UpstreamFailureException;
import com.nevis.chat.model.AssistantReply;
import com.nevis.chat.model.BillingMode;
import com.nevis.chat.model.BudgetSummary;
import com.nevis.chat.model.Citation;
import com.nevis.chat.model.CostMetrics;
import com.nevis.chat.model.MessageRole;
import com.nevis.chat.model.PricingTier;
import com.nevis.chat.model.ProviderId;
import com.nevis.chat.model.ThreadMessage;
import com.nevis.chat.model.TurnCommand;
import com.nevis.chat.model.TurnResult;
import com.nevis.chat.model.UsageMetrics;
import com.nevis.chat.service.ChatTurnService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatController.class)
class ChatControllerTest {

    private static final UUID THREAD_ID = UUID.fromString("5b0f6f0e-2a55-4d43-8d0c-7f7a1c3c9e01");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ChatTurnService chatTurnService;

    private static TurnResult result() {
        ThreadMessage user = new ThreadMessage(UUID.randomUUID(), THREAD_ID, "alice", MessageRole.USER,
            "How do I sync?", null, null, null, null, OffsetDateTime.now());
        Citation citation = new Citation(1, "chunk-1", "doc-1", "https://support.clever.com/s/articles/1",
            "Sync guide", "Setup", 2.3457, "Open the sync page", 1.1);
        AssistantReply reply = new AssistantReply(UUID.randomUUID(), "Open the sync page [1].", "openai:gpt-5-mini",
            ProviderId.OPENAI, new UsageMetrics(2000, 1000, 3000),
            new CostMetrics(0.0005, 0.002, 0.0025, 0.25, 2, PricingTier.STANDARD, true),
            1, BillingMode.HOUSE_KEY, List.of(citation), OffsetDateTime.now());
        return new TurnResult(THREAD_ID, user, reply, new BudgetSummary(5, 1, 4, 96), 1, 6);
    }

    @Test
    @DisplayName("POST /threads/{id}/turns should run the turn and return 201")
    void createTurn_ShouldReturn201() throws Exception {
        when(chatTurnService.runTurn(any())).thenReturn(result());

        mockMvc.perform(post("/threads/{id}/turns", THREAD_ID)
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"content": "How do I sync?", "sources": ["support.clever.com"], "top_k": 4,
                     "model_id": "openai:gpt-5-mini"}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.thread_id").value(THREAD_ID.toString()))
            .andExpect(jsonPath("$.assistant.role").value("assistant"))
            .andExpect(jsonPath("$.assistant.billing_mode").value("house_key"))
            .andExpect(jsonPath("$.assistant.cost.pricing_tier").value("standard"))
            .andExpect(jsonPath("$.assistant.citations[0].index").value(1))
            .andExpect(jsonPath("$.assistant.citations[0].chunk_id").value("chunk-1"))
            .andExpect(jsonPath("$.budget.charged_cents").value(1))
            .andExpect(jsonPath("$.budget.remaining_balance_cents").value(96))
            .andExpect(jsonPath("$.retrieval.top_k").value(6));

        ArgumentCaptor<TurnCommand> command = ArgumentCaptor.forClass(TurnCommand.class);
        verify(chatTurnService).runTurn(command.capture());
        assertThat(command.getValue().userId()).isEqualTo("alice");
        assertThat(command.getValue().threadId()).isEqualTo(THREAD_ID);
        assertThat(command.getValue().topK()).isEqualTo(4.0);
        assertThat(command.getValue().sources()).containsExactly("support.clever.com");
    }

    @Test
    @DisplayName("POST /threads/{id}/turns should return 400 when content is blank")
    void createTurn_ShouldReturn400_WhenContentBlank() throws Exception {
        mockMvc.perform(post("/threads/{id}/turns", THREAD_ID)
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \" \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("invalid_request"));

        verifyNoInteractions(chatTurnService);
    }

    @Test
    @DisplayName("POST /threads/{id}/turns should return 400 when the user header is missing")
    void createTurn_ShouldReturn400_WhenHeaderMissing() throws Exception {
        mockMvc.perform(post("/threads/{id}/turns", THREAD_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"hi\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("missing_header"));
    }

    @Test
    @DisplayName("POST /threads/{id}/turns should return 402 with the remaining balance")
    void createTurn_ShouldReturn402_WhenBalanceInsufficient() throws Exception {
        when(chatTurnService.runTurn(any())).thenThrow(new InsufficientBalanceException("alice", 7, 2));

        mockMvc.perform(post("/threads/{id}/turns", THREAD_ID)
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"hi\"}"))
            .andExpect(status().isPaymentRequired())
            .andExpect(jsonPath("$.code").value("insufficient_balance"))
            .andExpect(jsonPath("$.remaining_balance_cents").value(2));
    }

    @Test
    @DisplayName("POST /threads/{id}/turns should return 403 for threads the user cannot see")
    void createTurn_ShouldReturn403_WhenForbidden() throws Exception {
        when(chatTurnService.runTurn(any())).thenThrow(new ForbiddenException(THREAD_ID));

        mockMvc.perform(post("/threads/{id}/turns", THREAD_ID)
                .header("X-User-Id", "mallory")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"hi\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("forbidden"));
    }

    @Test
    @DisplayName("POST /threads/{id}/turns should hide provider details on upstream failure")
    void createTurn_ShouldReturn502_WhenProviderFails() throws Exception {
        when(chatTurnService.runTurn(any()))
            .thenThrow(new UpstreamFailureException(new IllegalStateException("401 invalid key sk-abc")));

        mockMvc.perform(post("/threads/{id}/turns", THREAD_ID)
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"hi\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.code").value("provider_request_failed"))
            .andExpect(jsonPath("$.error").value("Model provider request failed."));
    }
}
