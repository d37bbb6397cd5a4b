package com.tradeagent.risk;

import java.util.Set;
import lombok.Builder;
import lombok.Data;

/** Trading-mode switches consulted by the risk engine. */
@Data
@Builder
public class TradingRules {

    private boolean killSwitch;
    private Set<String> whitelist;
    private boolean longOnly;
}
