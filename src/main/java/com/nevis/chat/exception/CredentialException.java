package com.nevis.chat.exception;

import org.springframework.http.HttpStatus;

public class CredentialException extends TurnException {

    public static final String DECRYPT_FAILED = "api_key_decrypt_failed";

    public CredentialException() {
        super("Unable to decrypt stored API key.", DECRYPT_FAILED, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    public CredentialException(Throwable cause) {
        super("Unable to decrypt stored API key.", DECRYPT_FAILED, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }

    public CredentialException(String message, String code) {
        super(message, code, HttpStatus.BAD_REQUEST);
    }
}
