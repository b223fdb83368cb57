package com.nevis.chat.exception;

import org.springframework.http.HttpStatus;

public class InvalidTurnRequestException extends TurnException {

    public InvalidTurnRequestException(String message, String code) {
        super(message, code, HttpStatus.BAD_REQUEST);
    }
}
