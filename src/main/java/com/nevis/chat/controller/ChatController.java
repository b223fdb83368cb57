package com.nevis.chat.controller;

import com.nevis.chat.model.TurnCommand;
import com.nevis.chat.service.ChatTurnService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class ChatController {

    static final String USER_HEADER = "X-User-Id";

    private final ChatTurnService chatTurnService;

    @PostMapping("/threads/{threadId}/turns")
    public ResponseEntity<TurnResponse> createTurn(
        @RequestHeader(USER_HEADER) String userId,
        @PathVariable UUID threadId,
        @Valid @RequestBody TurnRequest request) {

        var command = new TurnCommand(
            userId,
            threadId,
            request.content(),
            request.sources(),
            request.modelId(),
            request.topK(),
            request.temperature(),
            request.maxOutputTokens(),
            request.userApiKeyId()
        );
        var result = chatTurnService.runTurn(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(TurnResponse.from(result));
    }
}
