package com.perptrader.backend.exception;

/**
 * The model endpoint could not produce a response: either the retry budget for transient
 * failures was used up or a non-retryable failure occurred.
 */
public class AIUnavailableException extends TradingException {

    private final int attempts;

    public AIUnavailableException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
