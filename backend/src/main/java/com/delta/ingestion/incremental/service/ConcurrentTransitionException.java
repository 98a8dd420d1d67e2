package com.delta.ingestion.incremental.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ConcurrentTransitionException extends RuntimeException {
    public ConcurrentTransitionException(String message) {
        super(message);
    }

    public ConcurrentTransitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
