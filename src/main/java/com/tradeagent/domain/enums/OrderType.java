package com.tradeagent.domain.enums;

import java.util.Locale;

public enum OrderType {
    LIMIT;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
