package com.tradeagent.risk;

import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.PositionState;
import com.tradeagent.store.TradeStore;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Builds a fresh {@link RiskState} from storage for the UTC day containing {@code now}.
 *
 * <p>Never cached: proposal and execution both read it immediately before calling the
 * risk engine.
 */
@Service
public class RiskStateService {

    private final TradeStore tradeStore;

    public RiskStateService(TradeStore tradeStore) {
        this.tradeStore = tradeStore;
    }

    public RiskState snapshot(PositionState position, BigDecimal markPrice, Instant now) {
        LocalDate day = RiskState.utcDay(now);
        BigDecimal unrealized = BigDecimal.ZERO;
        if (markPrice != null && position.getPosition().signum() > 0) {
            unrealized = markPrice.subtract(position.getAvgCost()).multiply(position.getPosition());
        }
        return RiskState.fromStorageSnapshot(
                day,
                tradeStore.dailyRealizedPnl(day),
                tradeStore.dailyExecutionCount(day),
                tradeStore.lastExecutionTime().orElse(null),
                unrealized);
    }

    /** Latest stored close, used to mark the open position. */
    public static BigDecimal markPrice(List<Candle> candles, BigDecimal fallback) {
        if (candles == null || candles.isEmpty()) {
            return fallback;
        }
        return candles.get(candles.size() - 1).getClose();
    }
}
