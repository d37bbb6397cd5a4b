package com.tradeagent.market;

import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.OrderBookSnapshot;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Exchange binding used by ingest and live execution.
 *
 * <p>Only top-of-book, OHLCV history and basic order verbs are required. Exchanges without
 * native post-only support get maker-price emulation from the execution engine; exchanges
 * without OHLCV get candles synthesized from public trades by {@link CandleSynthesizer}.
 * Every method may throw {@link com.tradeagent.exception.MarketException}.
 */
public interface MarketClient {

    String name();

    boolean supportsOhlcv();

    boolean supportsPostOnly();

    boolean hasCredentials();

    List<Candle> fetchCandles(String symbol, String timeframe, int limit);

    List<MarketTrade> fetchTrades(String symbol, int limit);

    OrderBookSnapshot fetchOrderBook(String symbol);

    /** Smallest price increment, when the exchange reports one. */
    Optional<BigDecimal> priceTick(String symbol);

    ExchangeOrder createLimitOrder(String symbol, TradeSide side, BigDecimal size, BigDecimal price, boolean postOnly);

    ExchangeOrder fetchOrder(String orderId, String symbol);

    void cancelOrder(String orderId, String symbol);
}
