package com.nevis.chat.service;

import com.nevis.chat.exception.TurnException;
import com.nevis.chat.infra.RateLimiter;
import com.nevis.chat.model.AuditResult;
import com.nevis.chat.model.CredentialAuditEvent;
import com.nevis.chat.model.PreparedTurn;
import com.nevis.chat.model.TurnCommand;
import com.nevis.chat.model.TurnExecution;
import com.nevis.chat.model.TurnResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ChatTurnServiceImpl implements ChatTurnService {

    static final String RELEASE_REASON = "provider_error";
    static final String DEFAULT_RELEASE_CODE = "provider_request_failed";

    private final TurnPreparer turnPreparer;
    private final TurnExecutor turnExecutor;
    private final TurnFinalizer turnFinalizer;
    private final LedgerService ledgerService;
    private final CredentialAuditLogger auditLogger;
    private final RateLimiter turnLimiter;

    public ChatTurnServiceImpl(TurnPreparer turnPreparer,
                               TurnExecutor turnExecutor,
                               TurnFinalizer turnFinalizer,
                               LedgerService ledgerService,
                               CredentialAuditLogger auditLogger,
                               @Qualifier("turnLimiter") RateLimiter turnLimiter) {
        this.turnPreparer = turnPreparer;
        this.turnExecutor = turnExecutor;
        this.turnFinalizer = turnFinalizer;
        this.ledgerService = ledgerService;
        this.auditLogger = auditLogger;
        this.turnLimiter = turnLimiter;
    }

    @Override
    public TurnResult runTurn(TurnCommand command) {
        turnLimiter.acquireOrThrow(command.userId());

        PreparedTurn prepared = turnPreparer.prepare(command);

        TurnExecution execution;
        try {
            execution = turnExecutor.execute(prepared, command.sources());
        } catch (TurnExecutionFailure e) {
            compensate(prepared, e);
            throw e.getFailure();
        }

        try {
            TurnResult result = turnFinalizer.finalizeTurn(prepared, execution);
            log.info("Turn {} completed on thread {} with {} citations, charged {} cents",
                prepared.requestId(), prepared.thread().id(), result.retrievalCount(), result.budget().chargedCents());
            return result;
        } catch (RuntimeException e) {
            log.error("Finalize failed for request {} (reserved {} cents, measured {} cents); ledger state needs review",
                prepared.requestId(), execution.reservedCents(), execution.actualCostCents(), e);
            throw e;
        }
    }

    private void compensate(PreparedTurn prepared, TurnExecutionFailure failure) {
        RuntimeException cause = failure.getFailure();

        if (prepared.personalCredential() && !prepared.credentialAuditLogged()) {
            auditLogger.log(new CredentialAuditEvent(
                prepared.userId(),
                CredentialAuditEvent.USE_ACTION,
                prepared.credentialId(),
                prepared.provider(),
                AuditResult.FAILURE,
                prepared.requestId(),
                CredentialAuditLogger.reasonCodeOf(cause)
            ));
        }

        if (failure.getReservedCents() <= 0) {
            return;
        }

        String code = cause instanceof TurnException turnException && turnException.getCode() != null
            ? turnException.getCode()
            : DEFAULT_RELEASE_CODE;
        try {
            ledgerService.release(prepared.userId(), failure.getReservedCents(), prepared.correlation(), RELEASE_REASON, code);
        } catch (RuntimeException releaseFailure) {
            log.error("Could not release {} cents reserved by request {}",
                failure.getReservedCents(), prepared.requestId(), releaseFailure);
            cause.addSuppressed(releaseFailure);
        }
    }
}
