package com.nevis.chat.exception;

import org.springframework.http.HttpStatus;

public class ModelCatalogException extends TurnException {

    public ModelCatalogException(String message, String code) {
        super(message, code, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
