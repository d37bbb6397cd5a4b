package com.tradeagent.unit.reporting;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.TradeResult;
import com.tradeagent.reporting.PerformanceCalculator;
import com.tradeagent.reporting.PerformanceReport;
import com.tradeagent.reporting.ReportWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for PerformanceCalculator and ReportWriter.
 */
class PerformanceCalculatorTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final BigDecimal CAPITAL = new BigDecimal("100000");

    private PerformanceCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new PerformanceCalculator();
    }

    private static TradeResult trade(TradeSide side, String pnl, int day) {
        return TradeResult.builder()
                .tradeId("t" + day)
                .symbol("BTC/JPY")
                .side(side)
                .size(BigDecimal.ONE)
                .price(new BigDecimal("1000"))
                .fee(BigDecimal.ONE)
                .realizedPnl(new BigDecimal(pnl))
                .timestamp(T0.plus(Duration.ofDays(day)))
                .build();
    }

    private List<TradeResult> sample() {
        List<TradeResult> trades = new ArrayList<>();
        trades.add(trade(TradeSide.BUY, "0", 0));
        trades.add(trade(TradeSide.SELL, "300", 1));
        trades.add(trade(TradeSide.BUY, "0", 2));
        trades.add(trade(TradeSide.SELL, "-500", 3));
        trades.add(trade(TradeSide.BUY, "0", 4));
        trades.add(trade(TradeSide.SELL, "100", 5));
        return trades;
    }

    // ==============================
    // METRICS
    // ==============================

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("Totals, win rate and profit factor")
        void totals() {
            PerformanceReport report = calculator.calculate(sample(), CAPITAL, T0, T0.plus(Duration.ofDays(5)));

            assertThat(report.getNumTrades()).isEqualTo(6);
            assertThat(report.getTotalPnl()).isEqualByComparingTo("-100");
            assertThat(report.getTotalReturn()).isEqualByComparingTo("-0.001");
            assertThat(report.getWinRate()).isEqualByComparingTo("0.333333");
            assertThat(report.getProfitFactor()).isEqualByComparingTo("0.8");
            assertThat(report.getTurnover()).isEqualByComparingTo("6000");
            assertThat(report.getFees()).isEqualByComparingTo("6");
        }

        @Test
        @DisplayName("Max drawdown is the largest fall from a running peak")
        void maxDrawdown() {
            PerformanceReport report = calculator.calculate(sample(), CAPITAL, null, null);

            assertThat(calculator.equityCurve(sample()))
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(
                            new BigDecimal("0"), new BigDecimal("300"), new BigDecimal("300"),
                            new BigDecimal("-200"), new BigDecimal("-200"), new BigDecimal("-100"));
            assertThat(report.getMaxDrawdown()).isEqualByComparingTo("500");
        }

        @Test
        @DisplayName("No trades gives an all-zero report")
        void empty() {
            PerformanceReport report = calculator.calculate(List.of(), CAPITAL, T0, T0.plus(Duration.ofDays(1)));

            assertThat(report.getNumTrades()).isZero();
            assertThat(report.getSharpe()).isEqualByComparingTo("0");
            assertThat(report.getMaxDrawdown()).isEqualByComparingTo("0");
            assertThat(report.getCagr()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Positive return over a year annualizes to itself")
        void cagrOverOneYear() {
            List<TradeResult> trades = List.of(trade(TradeSide.SELL, "10000", 0));

            PerformanceReport report = calculator.calculate(
                    trades, CAPITAL, T0, T0.plus(Duration.ofSeconds((long) (365.25 * 24 * 3600))));

            assertThat(report.getCagr()).isEqualByComparingTo("0.1");
        }

        @Test
        @DisplayName("Sharpe is positive for consistently winning trades")
        void sharpeSign() {
            List<TradeResult> trades = List.of(
                    trade(TradeSide.SELL, "100", 0), trade(TradeSide.SELL, "200", 1), trade(TradeSide.SELL, "150", 2));

            PerformanceReport report = calculator.calculate(trades, CAPITAL, null, null);

            assertThat(report.getSharpe()).isPositive();
        }

        @Test
        @DisplayName("Sharpe ignores buys, which realize nothing")
        void sharpeOverSellsOnly() {
            List<TradeResult> sells = sample().stream().filter(t -> t.getSide() == TradeSide.SELL).toList();

            PerformanceReport all = calculator.calculate(sample(), CAPITAL, null, null);
            PerformanceReport sellsOnly = calculator.calculate(sells, CAPITAL, null, null);

            assertThat(all.getSharpe()).isEqualByComparingTo(sellsOnly.getSharpe());
            assertThat(all.getSharpe()).isEqualByComparingTo("-0.138675");
        }

        @Test
        @DisplayName("A single sell among buys gives no Sharpe")
        void sharpeNeedsTwoSells() {
            List<TradeResult> trades = List.of(
                    trade(TradeSide.BUY, "0", 0), trade(TradeSide.SELL, "300", 1), trade(TradeSide.BUY, "0", 2));

            assertThat(calculator.calculate(trades, CAPITAL, null, null).getSharpe()).isEqualByComparingTo("0");
        }
    }

    // ==============================
    // REPORT FILES
    // ==============================

    @Nested
    @DisplayName("Report files")
    class Output {

        @Test
        @DisplayName("Writes JSON report, equity CSV and text summary")
        void writesFiles(@TempDir Path dir) throws IOException {
            PerformanceReport report = calculator.calculate(sample(), CAPITAL, T0, T0.plus(Duration.ofDays(5)));

            ReportWriter.ReportFiles files = new ReportWriter().write(report, calculator.equityCurve(sample()), dir, "backtest_baseline");

            assertThat(files.getReport()).hasFileName("backtest_baseline_report.json");
            assertThat(Files.readString(files.getReport())).contains("\"numTrades\"");
            List<String> csv = Files.readAllLines(files.getEquity());
            assertThat(csv.get(0)).isEqualTo("step,equity");
            assertThat(csv).hasSize(7);
            assertThat(Files.readString(files.getSummary())).contains("Trades: 6");
        }
    }
}
