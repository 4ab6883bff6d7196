package com.perptrader.backend.model;

/**
 * Actions the model may emit, with their wire names.
 */
public enum TradeAction {
    OPEN_LONG("open_long", 2),
    OPEN_SHORT("open_short", 2),
    CLOSE_LONG("close_long", 1),
    CLOSE_SHORT("close_short", 1),
    HOLD("hold", 3),
    WAIT("wait", 3);

    public static final int UNKNOWN_PRIORITY = 999;

    private final String value;
    private final int priority;

    TradeAction(String value, int priority) {
        this.value = value;
        this.priority = priority;
    }

    public String getValue() {
        return value;
    }

    /** Execution priority: closes first, then opens, then no-ops. */
    public int getPriority() {
        return priority;
    }

    public boolean isOpen() {
        return this == OPEN_LONG || this == OPEN_SHORT;
    }

    public boolean isClose() {
        return this == CLOSE_LONG || this == CLOSE_SHORT;
    }

    public PositionSide getSide() {
        switch (this) {
            case OPEN_LONG:
            case CLOSE_LONG:
                return PositionSide.LONG;
            case OPEN_SHORT:
            case CLOSE_SHORT:
                return PositionSide.SHORT;
            default:
                return null;
        }
    }

    /**
     * @return the matching action, or null when the value is not one of the known wire names
     */
    public static TradeAction fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (TradeAction action : values()) {
            if (action.value.equals(value)) {
                return action;
            }
        }
        return null;
    }

    public static int priorityOf(String value) {
        TradeAction action = fromValue(value);
        return action == null ? UNKNOWN_PRIORITY : action.priority;
    }
}
