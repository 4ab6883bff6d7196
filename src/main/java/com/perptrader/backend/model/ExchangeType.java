package com.perptrader.backend.model;

public enum ExchangeType {
    BINANCE("binance"),
    HYPERLIQUID("hyperliquid"),
    ASTER("aster");

    private final String value;

    ExchangeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
