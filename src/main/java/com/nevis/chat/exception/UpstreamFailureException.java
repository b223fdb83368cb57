package com.nevis.chat.exception;

import org.springframework.http.HttpStatus;

/**
 * Provider call failed. The message is fixed so provider output never reaches the caller.
 */
public class UpstreamFailureException extends TurnException {

    public UpstreamFailureException(Throwable cause) {
        super("Model provider request failed.", "provider_request_failed", HttpStatus.BAD_GATEWAY, cause);
    }
}
