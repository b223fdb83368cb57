package com.nevis.chat.service;

import com.nevis.chat.model.TurnCommand;
import com.nevis.chat.model.TurnResult;

public interface ChatTurnService {

    /**
     * Runs one grounded turn: prepare, execute, finalize. A reservation taken during execute is
     * returned in full when the turn fails before finalize.
     */
    TurnResult runTurn(TurnCommand command);
}
