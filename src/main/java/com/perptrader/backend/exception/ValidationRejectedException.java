package com.perptrader.backend.exception;

import com.perptrader.backend.model.Decision;

/**
 * A parsed decision broke one of the hard risk rules.
 */
public class ValidationRejectedException extends TradingException {

    private final transient Decision decision;

    public ValidationRejectedException(String message, Decision decision) {
        super(message);
        this.decision = decision;
    }

    public Decision getDecision() {
        return decision;
    }
}
