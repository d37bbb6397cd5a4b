package com.tradeagent.market;

import com.tradeagent.domain.model.Candle;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buckets public trades into OHLCV candles for exchanges that do not serve OHLCV.
 *
 * <p>A bucket opens at {@code floor(ts / timeframe)}. Empty buckets are not emitted.
 */
public final class CandleSynthesizer {

    private CandleSynthesizer() {}

    public static List<Candle> fromTrades(String symbol, String timeframe, List<MarketTrade> trades) {
        long bucketMillis = timeframeDuration(timeframe).toMillis();
        Map<Long, List<MarketTrade>> buckets = new TreeMap<>();
        trades.stream()
                .sorted(Comparator.comparing(MarketTrade::getTimestamp))
                .forEach(trade -> buckets
                        .computeIfAbsent(
                                Math.floorDiv(trade.getTimestamp().toEpochMilli(), bucketMillis) * bucketMillis,
                                k -> new ArrayList<>())
                        .add(trade));

        List<Candle> candles = new ArrayList<>(buckets.size());
        buckets.forEach((openMillis, bucket) -> {
            BigDecimal high = bucket.get(0).getPrice();
            BigDecimal low = high;
            BigDecimal volume = BigDecimal.ZERO;
            for (MarketTrade trade : bucket) {
                high = high.max(trade.getPrice());
                low = low.min(trade.getPrice());
                volume = volume.add(trade.getAmount());
            }
            candles.add(Candle.builder()
                    .symbol(symbol)
                    .timeframe(timeframe)
                    .timestamp(Instant.ofEpochMilli(openMillis))
                    .open(bucket.get(0).getPrice())
                    .high(high)
                    .low(low)
                    .close(bucket.get(bucket.size() - 1).getPrice())
                    .volume(volume)
                    .build());
        });
        return candles;
    }

    /** Parses {@code 1m}, {@code 15m}, {@code 1h}, {@code 1d}. */
    public static Duration timeframeDuration(String timeframe) {
        String tf = timeframe.trim().toLowerCase(Locale.ROOT);
        if (tf.length() < 2) {
            throw new IllegalArgumentException("Unsupported timeframe: " + timeframe);
        }
        long amount = Long.parseLong(tf.substring(0, tf.length() - 1));
        return switch (tf.charAt(tf.length() - 1)) {
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Unsupported timeframe: " + timeframe);
        };
    }
}
