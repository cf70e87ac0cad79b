package com.folio.backend.exception;

public class NoOverlapException extends RuntimeException {
    public NoOverlapException(String message) {
        super(message);
    }
}
