package com.tradeagent.ingest;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.NewsItem;
import com.tradeagent.domain.model.OrderBookSnapshot;
import com.tradeagent.market.CandleSynthesizer;
import com.tradeagent.market.MarketClient;
import com.tradeagent.market.MarketTrade;
import com.tradeagent.news.NewsFeed;
import com.tradeagent.observability.AuditService;
import com.tradeagent.store.TradeStore;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pulls market data and news into the store.
 *
 * <p>Market ingest fetches candles for every whitelisted symbol and configured timeframe. When
 * the exchange does not serve OHLCV, candles are synthesized from its recent public trades.
 * Candle writes are upserts, so overlapping fetches are harmless.
 */
@Service
public class IngestService {

    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private static final int TRADE_FETCH_LIMIT = 1000;

    private final MarketClient marketClient;
    private final NewsFeed newsFeed;
    private final TradeStore tradeStore;
    private final TradeAgentProperties properties;
    private final AuditService auditService;
    private final Clock clock;

    public IngestService(
            MarketClient marketClient,
            NewsFeed newsFeed,
            TradeStore tradeStore,
            TradeAgentProperties properties,
            AuditService auditService,
            Clock clock) {
        this.marketClient = marketClient;
        this.newsFeed = newsFeed;
        this.tradeStore = tradeStore;
        this.properties = properties;
        this.auditService = auditService;
        this.clock = clock;
    }

    // ========================
    // MARKET
    // ========================

    public IngestResult ingestMarket(boolean includeOrderBook) {
        IngestResult result = new IngestResult();
        TradeAgentProperties.Trading trading = properties.getTrading();
        for (String symbol : trading.getWhitelist()) {
            for (String timeframe : trading.getTimeframes()) {
                try {
                    result.addCandles(tradeStore.saveCandles(fetchCandles(symbol, timeframe)));
                } catch (RuntimeException e) {
                    log.warn("Candle ingest failed for {} {}: {}", symbol, timeframe, e.getMessage());
                    result.addError(symbol + " " + timeframe + ": " + e.getMessage());
                }
            }
            if (includeOrderBook) {
                try {
                    OrderBookSnapshot book = marketClient.fetchOrderBook(symbol);
                    tradeStore.saveOrderBook(book);
                    result.orderBookSaved();
                } catch (RuntimeException e) {
                    log.warn("Order book ingest failed for {}: {}", symbol, e.getMessage());
                    result.addError(symbol + " orderbook: " + e.getMessage());
                }
            }
        }
        log.info(
                "Market ingest: {} new candles, {} order books, {} errors",
                result.getCandlesInserted(),
                result.getOrderBooksSaved(),
                result.getErrors().size());
        audit("MARKET_INGEST", result);
        return result;
    }

    private List<Candle> fetchCandles(String symbol, String timeframe) {
        int limit = properties.getTrading().getCandleLimit();
        if (marketClient.supportsOhlcv()) {
            return marketClient.fetchCandles(symbol, timeframe, limit);
        }
        List<MarketTrade> trades = marketClient.fetchTrades(symbol, TRADE_FETCH_LIMIT);
        List<Candle> candles = CandleSynthesizer.fromTrades(symbol, timeframe, trades);
        log.debug("Synthesized {} {} candles for {} from {} trades", candles.size(), timeframe, symbol, trades.size());
        return candles;
    }

    // ========================
    // NEWS
    // ========================

    public IngestResult ingestNews() {
        IngestResult result = new IngestResult();
        try {
            List<NewsItem> items = newsFeed.fetch(clock.instant());
            result.addNews(tradeStore.saveNewsItems(items));
        } catch (RuntimeException e) {
            log.warn("News ingest failed: {}", e.getMessage());
            result.addError("news: " + e.getMessage());
        }
        log.info("News ingest: {} new items, {} errors", result.getNewsInserted(), result.getErrors().size());
        audit("NEWS_INGEST", result);
        return result;
    }

    private void audit(String eventType, IngestResult result) {
        auditService.log(
                eventType,
                "Ingest",
                marketClient.name(),
                Map.of(
                        "candles", result.getCandlesInserted(),
                        "orderBooks", result.getOrderBooksSaved(),
                        "news", result.getNewsInserted(),
                        "errors", result.getErrors().size()));
    }
}
