package com.tradeagent.execution;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.model.OrderIntent;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Decides whether an intent may execute without a human approval.
 *
 * <p>All must hold: autopilot enabled, symbol in the autopilot whitelist, notional within the
 * autopilot cap, the global per-trade loss cap no larger than the autopilot one, and
 * confidence at or above the autopilot threshold.
 */
@Component
public class AutopilotPolicy {

    private final TradeAgentProperties.Autopilot autopilot;
    private final BigDecimal globalMaxLossPerTrade;

    public AutopilotPolicy(TradeAgentProperties properties) {
        this.autopilot = properties.getAutopilot();
        this.globalMaxLossPerTrade = properties.getRisk().getMaxLossPerTrade();
    }

    public boolean permits(OrderIntent intent) {
        if (!autopilot.isEnabled()) {
            return false;
        }
        if (!autopilot.getWhitelist().contains(intent.getSymbol())) {
            return false;
        }
        if (intent.notional().compareTo(autopilot.getMaxNotional()) > 0) {
            return false;
        }
        if (globalMaxLossPerTrade.compareTo(autopilot.getMaxLossPerTrade()) > 0) {
            return false;
        }
        return intent.getConfidence().compareTo(autopilot.getMinConfidence()) >= 0;
    }
}
