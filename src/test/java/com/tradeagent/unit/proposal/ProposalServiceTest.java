package com.tradeagent.unit.proposal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.Fill;
import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.exception.BusinessException;
import com.tradeagent.intent.IntentFactory;
import com.tradeagent.intent.IntentService;
import com.tradeagent.news.NewsFeatureAggregator;
import com.tradeagent.news.PointInTimeNewsFilter;
import com.tradeagent.observability.AuditService;
import com.tradeagent.observability.TradeAgentMetrics;
import com.tradeagent.proposal.ProposalOutcome;
import com.tradeagent.proposal.ProposalService;
import com.tradeagent.proposal.ProposalStatus;
import com.tradeagent.risk.RiskEngine;
import com.tradeagent.risk.RiskStateService;
import com.tradeagent.strategy.StrategyRegistry;
import com.tradeagent.support.InMemoryTradeStore;
import com.tradeagent.support.MutableClock;
import com.tradeagent.support.TestData;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for ProposalService against the in-memory store, focused on closing a position.
 */
@ExtendWith(MockitoExtension.class)
class ProposalServiceTest {

    private static final Instant START = Instant.parse("2025-03-10T12:00:00Z");

    @Mock
    private AuditService auditService;

    private MutableClock clock;
    private InMemoryTradeStore tradeStore;
    private ProposalService proposalService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        tradeStore = new InMemoryTradeStore();
        TradeAgentProperties properties = new TradeAgentProperties();
        TradeAgentMetrics metrics = new TradeAgentMetrics(new SimpleMeterRegistry());
        IntentService intentService = new IntentService(new IntentFactory(clock), tradeStore, auditService, metrics);
        proposalService = new ProposalService(
                tradeStore,
                new StrategyRegistry(properties),
                new NewsFeatureAggregator(),
                new PointInTimeNewsFilter(Duration.ofSeconds(600), Duration.ofHours(12)),
                new RiskEngine(),
                new RiskStateService(tradeStore),
                TestData.limits(),
                TestData.rules(),
                intentService,
                properties,
                auditService,
                metrics,
                clock);
    }

    private void holdLong(String size, Instant boughtAt) {
        tradeStore.addFill(Fill.builder()
                .fillId("f-" + size)
                .execId("e-" + size)
                .symbol(TestData.SYMBOL)
                .side(TradeSide.BUY)
                .size(new BigDecimal(size))
                .price(new BigDecimal("1000"))
                .fee(BigDecimal.ZERO)
                .feeCurrency("JPY")
                .timestamp(boughtAt)
                .build());
    }

    private void storeCloses(String... closes) {
        tradeStore.saveCandles(TestData.candles(START.minus(Duration.ofMinutes(closes.length)), closes));
    }

    // ==============================
    // CLOSE POSITION
    // ==============================

    @Nested
    @DisplayName("Close position")
    class ClosePosition {

        @Test
        @DisplayName("Sells the whole long position at the latest close")
        void fullClose() {
            holdLong("3", START.minus(Duration.ofHours(1)));
            storeCloses("990", "1010");

            ProposalOutcome outcome = proposalService.closePosition(TestData.SYMBOL, TradingMode.PAPER);

            assertThat(outcome.getStatus()).isEqualTo(ProposalStatus.PROPOSED);
            OrderIntent intent = outcome.getIntent();
            assertThat(intent.getSide()).isEqualTo(TradeSide.SELL);
            assertThat(intent.getSize()).isEqualByComparingTo("3");
            assertThat(intent.getPrice()).isEqualByComparingTo("1010");
            assertThat(intent.getConfidence()).isEqualByComparingTo("1");
            assertThat(intent.getStrategy()).isEqualTo(ProposalService.MANUAL_CLOSE);
            assertThat(intent.getRationaleFeaturesRef()).isNull();
            assertThat(tradeStore.findIntent(intent.getIntentId()).orElseThrow().getStatus())
                    .isEqualTo(IntentStatus.PROPOSED);
            verify(auditService).log(
                    eq("RISK_CHECK"),
                    eq("Symbol"),
                    eq(TestData.SYMBOL),
                    argThat(details -> "approved".equals(details.get("status"))
                            && ProposalService.MANUAL_CLOSE.equals(details.get("strategy"))));
        }

        @Test
        @DisplayName("The notional cap shrinks a large position to a partial close")
        void partialClose() {
            holdLong("5", START.minus(Duration.ofHours(1)));
            storeCloses("1000", "1000");

            ProposalOutcome outcome = proposalService.closePosition(TestData.SYMBOL, TradingMode.PAPER);

            assertThat(outcome.getStatus()).isEqualTo(ProposalStatus.PROPOSED);
            assertThat(outcome.getIntent().getSize()).isEqualByComparingTo("4");
        }

        @Test
        @DisplayName("Nothing to close is a rejection without an intent")
        void flat() {
            ProposalOutcome outcome = proposalService.closePosition(TestData.SYMBOL, TradingMode.PAPER);

            assertThat(outcome.getStatus()).isEqualTo(ProposalStatus.REJECTED);
            assertThat(outcome.getReason()).isEqualTo("no position to close");
            assertThat(outcome.getIntent()).isNull();
            assertThat(tradeStore.recentIntents()).isEmpty();
        }

        @Test
        @DisplayName("Cooldown after a recent fill blocks the close")
        void cooldown() {
            holdLong("2", START.minus(Duration.ofMinutes(1)));
            storeCloses("1000", "1000");

            ProposalOutcome outcome = proposalService.closePosition(TestData.SYMBOL, TradingMode.PAPER);

            assertThat(outcome.getStatus()).isEqualTo(ProposalStatus.REJECTED);
            assertThat(outcome.getReason()).isEqualTo("cooldown active");
            assertThat(tradeStore.recentIntents()).isEmpty();
        }

        @Test
        @DisplayName("A position without any stored price cannot be closed")
        void noPrice() {
            holdLong("1", START.minus(Duration.ofHours(1)));

            assertThatThrownBy(() -> proposalService.closePosition(TestData.SYMBOL, TradingMode.PAPER))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("No latest price available for BTC/JPY");
        }
    }
}
