package com.perptrader.backend.exception;

/**
 * The model answered, but no decision array could be extracted from the text.
 * The reasoning trace found before the failure travels with the exception.
 */
public class MalformedResponseException extends TradingException {

    private final String reasoningTrace;

    public MalformedResponseException(String message, String reasoningTrace) {
        super(message);
        this.reasoningTrace = reasoningTrace;
    }

    public MalformedResponseException(String message, String reasoningTrace, Throwable cause) {
        super(message, cause);
        this.reasoningTrace = reasoningTrace;
    }

    public String getReasoningTrace() {
        return reasoningTrace;
    }
}
