package com.perptrader.backend.exception;

public class ConfigurationException extends TradingException {

    public ConfigurationException(String message) {
        super(message);
    }
}
