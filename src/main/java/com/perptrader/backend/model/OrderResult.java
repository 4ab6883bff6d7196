package com.perptrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResult {

    public enum Status {
        FILLED,
        SUBMITTED,
        /** Close requested with quantity 0 but the exchange has no such position. */
        NO_POSITION
    }

    private String orderId;
    private String symbol;
    private Status status;
    private double quantity;

    public boolean isNoPosition() {
        return status == Status.NO_POSITION;
    }

    public static OrderResult noPosition(String symbol) {
        return OrderResult.builder().symbol(symbol).status(Status.NO_POSITION).build();
    }
}
