package com.nevis.chat.controller;

import com.nevis.chat.service.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class BalanceController {

    private final LedgerService ledgerService;

    @GetMapping("/balances/me")
    public ResponseEntity<BalanceResponse> myBalance(@RequestHeader(ChatController.USER_HEADER) String userId) {
        return ResponseEntity.ok(BalanceResponse.from(ledgerService.balanceDetails(userId)));
    }

    @PostMapping("/ops/balances/{userId}/grants")
    public ResponseEntity<BalanceResponse> grant(
        @RequestHeader(ChatController.USER_HEADER) String actorUserId,
        @PathVariable String userId,
        @Valid @RequestBody GrantRequest request) {

        ledgerService.grant(userId, request.amountCents(), actorUserId, request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(BalanceResponse.from(ledgerService.balanceDetails(userId)));
    }
}
