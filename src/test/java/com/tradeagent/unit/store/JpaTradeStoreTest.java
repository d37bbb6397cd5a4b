package com.tradeagent.unit.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeagent.domain.enums.ExecutionStatus;
import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.Execution;
import com.tradeagent.domain.model.Fill;
import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.domain.model.TradePlan;
import com.tradeagent.domain.model.TradeResult;
import com.tradeagent.intent.IntentFactory;
import com.tradeagent.intent.IntentService;
import com.tradeagent.mapper.OrderIntentMapper;
import com.tradeagent.repository.jpa.OrderIntentJpaRepository;
import com.tradeagent.store.JpaTradeStore;
import com.tradeagent.support.TestData;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Import;

/**
 * JpaTradeStore against an embedded H2 database. Every read-back goes through a flush and a
 * cleared persistence context so values come from the columns, not the session cache.
 */
@DataJpaTest
@Import({JpaTradeStore.class, JpaTradeStoreTest.StoreConfig.class})
class JpaTradeStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    @TestConfiguration
    @ComponentScan(basePackageClasses = OrderIntentMapper.class)
    static class StoreConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private JpaTradeStore tradeStore;

    @Autowired
    private OrderIntentJpaRepository intentRepository;

    private IntentFactory intentFactory;

    @BeforeEach
    void setUp() {
        intentFactory = new IntentFactory(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private OrderIntent intent(String size, String price, String confidence) {
        TradePlan plan = TestData.plan(TradeSide.BUY, size, price).toBuilder()
                .confidence(new BigDecimal(confidence))
                .rationale("fast SMA above slow SMA; news sentiment élevé")
                .build();
        return intentFactory.fromPlan(plan, TradingMode.PAPER, 900, null);
    }

    private OrderIntent reload(String intentId) {
        entityManager.flush();
        entityManager.clear();
        return tradeStore.findIntent(intentId).orElseThrow();
    }

    // ==============================
    // INTENTS
    // ==============================

    @Test
    @DisplayName("Inserting the same intent twice is a no-op that leaves one row")
    void idempotentInsert() {
        OrderIntent intent = intent("0.5", "1000", "0.7");

        assertThat(tradeStore.insertIntent(intent)).isTrue();
        entityManager.flush();
        assertThat(tradeStore.insertIntent(intent.toBuilder().status(IntentStatus.APPROVED).build())).isFalse();

        assertThat(intentRepository.count()).isEqualTo(1);
        assertThat(reload(intent.getIntentId()).getStatus()).isEqualTo(IntentStatus.PROPOSED);
    }

    @Test
    @DisplayName("Hash still verifies after a database round trip with full-precision numbers")
    void hashSurvivesRoundTrip() {
        OrderIntent intent = intent("0.123456789012", "5012345.678901234567", "0.6666666667");
        tradeStore.insertIntent(intent);

        OrderIntent loaded = reload(intent.getIntentId());

        assertThat(loaded.getConfidence()).isEqualByComparingTo("0.6666666667");
        assertThat(loaded.getSize()).isEqualByComparingTo("0.123456789012");
        assertThat(loaded.getCreatedAt()).isEqualTo(intent.getCreatedAt());
        assertThat(loaded.getIntentHash()).isEqualTo(intent.getIntentHash());
        assertThat(IntentService.isIntact(loaded)).isTrue();
    }

    @Test
    @DisplayName("A transition out of a terminal status is refused and not written")
    void refusedTransition() {
        OrderIntent intent = intent("0.5", "1000", "0.7");
        tradeStore.insertIntent(intent);
        assertThat(tradeStore.updateIntentStatus(intent.getIntentId(), IntentStatus.EXPIRED)).isTrue();
        entityManager.flush();

        assertThat(tradeStore.updateIntentStatus(intent.getIntentId(), IntentStatus.APPROVED)).isFalse();

        assertThat(reload(intent.getIntentId()).getStatus()).isEqualTo(IntentStatus.EXPIRED);
    }

    // ==============================
    // EXECUTIONS
    // ==============================

    @Test
    @DisplayName("Recording an execution writes the execution, fill, trade result and intent status")
    void recordExecution() {
        OrderIntent intent = intent("0.5", "1000", "0.7");
        tradeStore.insertIntent(intent);
        tradeStore.updateIntentStatus(intent.getIntentId(), IntentStatus.APPROVED);

        Execution execution = Execution.builder()
                .execId("exec-1")
                .intentId(intent.getIntentId())
                .intentHash(intent.getIntentHash())
                .timestamp(NOW)
                .mode(TradingMode.PAPER)
                .status(ExecutionStatus.FILLED)
                .fee(new BigDecimal("0.5"))
                .slippageModel("paper_bps")
                .details(Map.of("message", "filled"))
                .build();
        Fill fill = Fill.builder()
                .fillId("fill-1")
                .execId("exec-1")
                .symbol(TestData.SYMBOL)
                .side(TradeSide.BUY)
                .size(new BigDecimal("0.5"))
                .price(new BigDecimal("1000.5"))
                .fee(new BigDecimal("0.5"))
                .feeCurrency("JPY")
                .timestamp(NOW)
                .build();
        TradeResult tradeResult = TradeResult.builder()
                .tradeId("trade-1")
                .execId("exec-1")
                .intentId(intent.getIntentId())
                .mode(TradingMode.PAPER)
                .symbol(TestData.SYMBOL)
                .side(TradeSide.BUY)
                .size(new BigDecimal("0.5"))
                .price(new BigDecimal("1000.5"))
                .fee(new BigDecimal("0.5"))
                .realizedPnl(BigDecimal.ZERO)
                .timestamp(NOW)
                .build();

        tradeStore.recordExecution(execution, fill, tradeResult, IntentStatus.FILLED);

        assertThat(reload(intent.getIntentId()).getStatus()).isEqualTo(IntentStatus.FILLED);
        assertThat(tradeStore.executionsForIntent(intent.getIntentId()))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.getStatus()).isEqualTo(ExecutionStatus.FILLED);
                    assertThat(e.getDetails()).containsEntry("message", "filled");
                });
        assertThat(tradeStore.fillsForExecution("exec-1")).hasSize(1);
        assertThat(tradeStore.tradeResults(TradingMode.PAPER))
                .singleElement()
                .extracting(TradeResult::getIntentId)
                .isEqualTo(intent.getIntentId());
        assertThat(tradeStore.tradeResults(TradingMode.LIVE)).isEmpty();
        assertThat(tradeStore.positionState(TestData.SYMBOL).getPosition()).isEqualByComparingTo("0.5");
        assertThat(tradeStore.dailyExecutionCount(NOW.atZone(ZoneOffset.UTC).toLocalDate())).isEqualTo(1);
        assertThat(tradeStore.lastExecutionTime()).contains(NOW);
    }
}
