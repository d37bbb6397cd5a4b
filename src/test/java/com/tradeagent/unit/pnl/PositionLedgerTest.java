package com.tradeagent.unit.pnl;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeagent.pnl.PositionLedger;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionLedgerTest {

    private PositionLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PositionLedger();
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Test
    @DisplayName("Buy fees are folded into the average cost")
    void buyFeesInCostBasis() {
        ledger.applyBuy(bd("2"), bd("100"), bd("2"));
        ledger.applyBuy(bd("2"), bd("110"), bd("2"));

        assertThat(ledger.getPosition()).isEqualByComparingTo("4");
        assertThat(ledger.getAvgCost()).isEqualByComparingTo("106");
        assertThat(ledger.getFeesPaid()).isEqualByComparingTo("4");
    }

    @Test
    @DisplayName("Sell realizes against the average cost net of its fee")
    void sellRealizes() {
        ledger.applyBuy(bd("4"), bd("100"), BigDecimal.ZERO);

        BigDecimal pnl = ledger.applySell(bd("1"), bd("120"), bd("1"));

        assertThat(pnl).isEqualByComparingTo("19");
        assertThat(ledger.getPosition()).isEqualByComparingTo("3");
        assertThat(ledger.getAvgCost()).isEqualByComparingTo("100");
        assertThat(ledger.getRealizedPnl()).isEqualByComparingTo("19");
    }

    @Test
    @DisplayName("Closing the whole position resets the cost basis")
    void fullClose() {
        ledger.applyBuy(bd("1"), bd("100"), BigDecimal.ZERO);
        ledger.applySell(bd("1"), bd("90"), BigDecimal.ZERO);

        assertThat(ledger.getPosition()).isEqualByComparingTo("0");
        assertThat(ledger.getAvgCost()).isEqualByComparingTo("0");
        assertThat(ledger.getRealizedPnl()).isEqualByComparingTo("-10");

        ledger.applyBuy(bd("1"), bd("50"), BigDecimal.ZERO);
        assertThat(ledger.getAvgCost()).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("Sell against a flat position is ignored")
    void sellWhenFlat() {
        BigDecimal pnl = ledger.applySell(bd("1"), bd("100"), bd("1"));

        assertThat(pnl).isEqualByComparingTo("0");
        assertThat(ledger.getPosition()).isEqualByComparingTo("0");
        assertThat(ledger.getFeesPaid()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Unrealized PnL marks the open position to the given price")
    void unrealized() {
        ledger.applyBuy(bd("2"), bd("100"), BigDecimal.ZERO);

        assertThat(ledger.unrealizedPnl(bd("95"))).isEqualByComparingTo("-10");
        assertThat(ledger.unrealizedPnl(null)).isEqualByComparingTo("0");
        assertThat(ledger.snapshot("BTC/JPY").getAvgCost()).isEqualByComparingTo("100");
    }
}
