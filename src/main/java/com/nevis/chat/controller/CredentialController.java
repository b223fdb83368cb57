package com.nevis.chat.controller;

import com.nevis.chat.exception.InvalidTurnRequestException;
import com.nevis.chat.model.ProviderId;
import com.nevis.chat.service.CredentialService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class CredentialController {

    private final CredentialService credentialService;

    @PostMapping("/me/credentials")
    public ResponseEntity<CredentialResponse> register(
        @RequestHeader(ChatController.USER_HEADER) String userId,
        @Valid @RequestBody CredentialRequest request) {

        ProviderId provider = ProviderId.fromWire(request.provider())
            .orElseThrow(() -> new InvalidTurnRequestException("Unknown provider: " + request.provider(), "invalid_provider"));
        var credential = credentialService.register(userId, provider, request.label(), request.apiKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(CredentialResponse.from(credential));
    }
}
