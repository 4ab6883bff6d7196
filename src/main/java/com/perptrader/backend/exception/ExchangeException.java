package com.perptrader.backend.exception;

/**
 * A balance, position or order call against an exchange failed.
 */
public class ExchangeException extends TradingException {

    private final String exchange;

    public ExchangeException(String exchange, String message) {
        super("[" + exchange + "] " + message);
        this.exchange = exchange;
    }

    public ExchangeException(String exchange, String message, Throwable cause) {
        super("[" + exchange + "] " + message, cause);
        this.exchange = exchange;
    }

    public String getExchange() {
        return exchange;
    }
}
