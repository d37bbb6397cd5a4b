package com.tradeagent.domain.enums;

/** Good-till-cancelled is the only policy the engine places; the order timeout cancels it. */
public enum TimeInForce {
    GTC;

    public String wireValue() {
        return name();
    }
}
