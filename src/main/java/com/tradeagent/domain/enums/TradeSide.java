package com.tradeagent.domain.enums;

import java.util.Locale;

/** Direction of a trade decision. HOLD is informational only and never reaches an order. */
public enum TradeSide {
    BUY,
    SELL,
    HOLD;

    /** Lower-case form used in canonical intent JSON and dedup signatures. */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TradeSide fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
