package com.tradeagent.market;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/** Exchange view of a placed order. */
@Data
@Builder(toBuilder = true)
public class ExchangeOrder {

    private static final Set<String> DONE = Set.of("closed", "filled");

    private String orderId;

    /** Exchange status string, e.g. {@code open}, {@code closed}, {@code canceled}. */
    private String status;

    private BigDecimal filled;

    /** Average fill price; null until something filled. */
    private BigDecimal average;

    private BigDecimal price;

    public boolean isDone() {
        return status != null && DONE.contains(status.toLowerCase(Locale.ROOT));
    }
}
