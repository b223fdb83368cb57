package com.nevis.chat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for failures that carry a stable machine-readable code.
 */
@Getter
public class TurnException extends RuntimeException {
    private final String code;
    private final HttpStatus status;

    public TurnException(String message, String code, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
    }

    public TurnException(String message, String code, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}
