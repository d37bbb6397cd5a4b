package com.tradeagent.domain.enums;

import java.util.Locale;

/** PAPER fills against the simulator, LIVE places real orders through the market client. */
public enum TradingMode {
    PAPER,
    LIVE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TradingMode fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
