package com.tradeagent.intent;

import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.domain.model.TradePlan;
import com.tradeagent.exception.ResourceNotFoundException;
import com.tradeagent.observability.AuditService;
import com.tradeagent.observability.TradeAgentMetrics;
import com.tradeagent.store.TradeStore;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates, stores and moves order intents through their lifecycle.
 *
 * <p>Storing is idempotent on intent id so a scheduler retry never duplicates an intent.
 * Status changes go through {@link IntentStatus#canTransitionTo}; an illegal move (for
 * example reviving an expired intent) is refused and logged.
 */
@Service
public class IntentService {

    private static final Logger log = LoggerFactory.getLogger(IntentService.class);

    private final IntentFactory intentFactory;
    private final TradeStore tradeStore;
    private final AuditService auditService;
    private final TradeAgentMetrics metrics;

    public IntentService(
            IntentFactory intentFactory,
            TradeStore tradeStore,
            AuditService auditService,
            TradeAgentMetrics metrics) {
        this.intentFactory = intentFactory;
        this.tradeStore = tradeStore;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    /** Freezes an approved plan into a new intent and stores it with status PROPOSED. */
    public OrderIntent propose(TradePlan approvedPlan, TradingMode mode, int expirySeconds, String featuresRef) {
        OrderIntent intent = intentFactory.fromPlan(approvedPlan, mode, expirySeconds, featuresRef);
        store(intent);
        return intent;
    }

    /**
     * @return true when the intent was written, false when an intent with that id already existed
     */
    public boolean store(OrderIntent intent) {
        boolean inserted = tradeStore.insertIntent(intent);
        if (inserted) {
            metrics.intentProposed();
            auditService.log(
                    "INTENT_PROPOSED",
                    "OrderIntent",
                    intent.getIntentId(),
                    Map.of(
                            "symbol", intent.getSymbol(),
                            "side", intent.getSide().wireValue(),
                            "size", intent.getSize().toPlainString(),
                            "price", intent.getPrice().toPlainString(),
                            "intentHash", intent.getIntentHash()));
            log.info(
                    "Intent {} proposed: {} {} {} @ {} ({}), expires {}",
                    intent.getIntentId(),
                    intent.getSide(),
                    intent.getSize().toPlainString(),
                    intent.getSymbol(),
                    intent.getPrice().toPlainString(),
                    intent.getMode(),
                    intent.getExpiresAt());
        }
        return inserted;
    }

    public Optional<OrderIntent> find(String intentId) {
        return tradeStore.findIntent(intentId);
    }

    public OrderIntent get(String intentId) {
        return tradeStore.findIntent(intentId).orElseThrow(() -> new ResourceNotFoundException("OrderIntent", intentId));
    }

    /** Applies the transition when allowed. Returns false when it was refused. */
    public boolean transition(String intentId, IntentStatus target) {
        boolean applied = tradeStore.updateIntentStatus(intentId, target);
        if (applied) {
            auditService.log("INTENT_STATUS", "OrderIntent", intentId, Map.of("status", target.wireValue()));
        }
        return applied;
    }

    /** True when the stored fields still hash to the hash recorded at creation. */
    public static boolean isIntact(OrderIntent intent) {
        return intent.getIntentHash() != null && intent.getIntentHash().equals(IntentHasher.hash(intent));
    }
}
