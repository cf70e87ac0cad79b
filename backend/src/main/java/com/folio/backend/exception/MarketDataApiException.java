package com.folio.backend.exception;

public class MarketDataApiException extends RuntimeException {
    private final int statusCode;

    public MarketDataApiException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public MarketDataApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public MarketDataApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
