package com.folio.backend.exception;

/**
 * The market-data provider has nothing for the requested ticker and window,
 * or could not be reached.
 */
public class DataUnavailableException extends RuntimeException {
    private final String ticker;

    public DataUnavailableException(String ticker, String message) {
        super(message);
        this.ticker = ticker;
    }

    public DataUnavailableException(String ticker, String message, Throwable cause) {
        super(message, cause);
        this.ticker = ticker;
    }

    public String getTicker() {
        return ticker;
    }
}
