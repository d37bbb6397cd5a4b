package com.tradeagent.market;

import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.OrderBookSnapshot;
import com.tradeagent.exception.MarketException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process simulated exchange, registered under the name {@code paper}.
 *
 * <p>Prices follow a seeded random walk with one trade print per second of wall-clock time,
 * generated lazily whenever the market is queried. Like many spot venues it serves neither
 * OHLCV nor native post-only orders, so ingest synthesizes candles from its trades and live
 * execution emulates maker prices against it.
 *
 * <p>Resting limit orders fill at their limit price once the last trade reaches it:
 * <ul>
 *   <li>BUY: fills when last price &lt;= limit</li>
 *   <li>SELL: fills when last price &gt;= limit</li>
 * </ul>
 */
public class PaperMarketClient implements MarketClient {

    private static final Logger log = LoggerFactory.getLogger(PaperMarketClient.class);

    public static final String NAME = "paper";

    private static final int MAX_TAPE = 5000;
    private static final int MAX_CATCH_UP = 1000;
    private static final BigDecimal BPS = new BigDecimal("10000");

    private final Clock clock;
    private final Random random;
    private final BigDecimal startPrice;
    private final double volatility;
    private final BigDecimal spreadBps;
    private final BigDecimal priceTick;
    private final boolean credentials;

    private final Map<String, Deque<MarketTrade>> tapes = new HashMap<>();
    private final Map<String, SimOrder> orders = new HashMap<>();

    public PaperMarketClient(
            Clock clock,
            long seed,
            BigDecimal startPrice,
            BigDecimal volatilityBps,
            BigDecimal spreadBps,
            BigDecimal priceTick,
            boolean credentials) {
        this.clock = clock;
        this.random = new Random(seed);
        this.startPrice = startPrice;
        this.volatility = volatilityBps.doubleValue() / 10000.0;
        this.spreadBps = spreadBps;
        this.priceTick = priceTick;
        this.credentials = credentials;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsOhlcv() {
        return false;
    }

    @Override
    public boolean supportsPostOnly() {
        return false;
    }

    @Override
    public boolean hasCredentials() {
        return credentials;
    }

    @Override
    public List<Candle> fetchCandles(String symbol, String timeframe, int limit) {
        throw new MarketException("paper exchange does not serve OHLCV");
    }

    @Override
    public synchronized List<MarketTrade> fetchTrades(String symbol, int limit) {
        Deque<MarketTrade> tape = advance(symbol);
        List<MarketTrade> all = new ArrayList<>(tape);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    @Override
    public synchronized OrderBookSnapshot fetchOrderBook(String symbol) {
        MarketTrade last = advance(symbol).getLast();
        BigDecimal halfSpread = last.getPrice().multiply(spreadBps).divide(BPS, MathContext.DECIMAL64)
                .divide(BigDecimal.valueOf(2), MathContext.DECIMAL64);
        return OrderBookSnapshot.builder()
                .symbol(symbol)
                .timestamp(last.getTimestamp())
                .bid(last.getPrice().subtract(halfSpread).max(BigDecimal.ZERO))
                .ask(last.getPrice().add(halfSpread))
                .lastPrice(last.getPrice())
                .build();
    }

    @Override
    public Optional<BigDecimal> priceTick(String symbol) {
        return Optional.ofNullable(priceTick);
    }

    @Override
    public synchronized ExchangeOrder createLimitOrder(
            String symbol, TradeSide side, BigDecimal size, BigDecimal price, boolean postOnly) {
        if (side == TradeSide.HOLD) {
            throw new MarketException("cannot place a HOLD order");
        }
        String orderId = "SIM-" + UUID.randomUUID().toString().substring(0, 8);
        SimOrder order = new SimOrder(orderId, symbol, side, size, price);
        orders.put(orderId, order);
        log.debug("Paper order placed: {} {} {} @ {}", orderId, side, size.toPlainString(), price.toPlainString());
        return order.view();
    }

    @Override
    public synchronized ExchangeOrder fetchOrder(String orderId, String symbol) {
        SimOrder order = require(orderId);
        if ("open".equals(order.status)) {
            BigDecimal last = advance(symbol).getLast().getPrice();
            boolean crossed = order.side == TradeSide.BUY
                    ? last.compareTo(order.price) <= 0
                    : last.compareTo(order.price) >= 0;
            if (crossed) {
                order.status = "closed";
                order.filled = order.size;
                order.average = order.price;
            }
        }
        return order.view();
    }

    @Override
    public synchronized void cancelOrder(String orderId, String symbol) {
        SimOrder order = require(orderId);
        if ("open".equals(order.status)) {
            order.status = "canceled";
        }
    }

    private SimOrder require(String orderId) {
        SimOrder order = orders.get(orderId);
        if (order == null) {
            throw new MarketException("unknown order " + orderId);
        }
        return order;
    }

    /** Extends the symbol's trade tape up to the current second. */
    private Deque<MarketTrade> advance(String symbol) {
        Deque<MarketTrade> tape = tapes.computeIfAbsent(symbol, s -> new ArrayDeque<>());
        Instant now = clock.instant();
        if (tape.isEmpty()) {
            tape.add(MarketTrade.builder().timestamp(now).price(startPrice).amount(nextAmount()).build());
            return tape;
        }
        MarketTrade last = tape.getLast();
        long missing = Math.min(Duration.between(last.getTimestamp(), now).getSeconds(), MAX_CATCH_UP);
        Instant ts = now.minusSeconds(missing);
        BigDecimal price = last.getPrice();
        for (long i = 0; i < missing; i++) {
            ts = ts.plusSeconds(1);
            double step = 1.0 + random.nextGaussian() * volatility;
            price = roundToTick(price.multiply(BigDecimal.valueOf(step), MathContext.DECIMAL64));
            tape.add(MarketTrade.builder().timestamp(ts).price(price).amount(nextAmount()).build());
            if (tape.size() > MAX_TAPE) {
                tape.removeFirst();
            }
        }
        return tape;
    }

    private BigDecimal nextAmount() {
        return BigDecimal.valueOf(0.001 + random.nextDouble() * 0.05).setScale(6, RoundingMode.HALF_UP);
    }

    private BigDecimal roundToTick(BigDecimal price) {
        if (priceTick == null || priceTick.signum() <= 0) {
            return price;
        }
        return price.divide(priceTick, 0, RoundingMode.HALF_UP).multiply(priceTick);
    }

    private static final class SimOrder {
        private final String orderId;
        private final String symbol;
        private final TradeSide side;
        private final BigDecimal size;
        private final BigDecimal price;
        private String status = "open";
        private BigDecimal filled = BigDecimal.ZERO;
        private BigDecimal average;

        private SimOrder(String orderId, String symbol, TradeSide side, BigDecimal size, BigDecimal price) {
            this.orderId = orderId;
            this.symbol = symbol;
            this.side = side;
            this.size = size;
            this.price = price;
        }

        private ExchangeOrder view() {
            return ExchangeOrder.builder()
                    .orderId(orderId)
                    .status(status)
                    .filled(filled)
                    .average(average)
                    .price(price)
                    .build();
        }
    }
}
