package com.tradeagent.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.OrderBookSnapshot;
import com.tradeagent.execution.MakerPriceEmulator;
import com.tradeagent.execution.MakerPriceEmulator.MakerPrice;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MakerPriceEmulatorTest {

    private static final BigDecimal BUFFER_BPS = new BigDecimal("1");

    private static OrderBookSnapshot book(String bid, String ask) {
        return OrderBookSnapshot.builder()
                .bid(bid != null ? new BigDecimal(bid) : null)
                .ask(ask != null ? new BigDecimal(ask) : null)
                .build();
    }

    @Test
    @DisplayName("Buy above the bid is clamped to the bid")
    void buyClampedToBid() {
        MakerPrice price = MakerPriceEmulator.emulate(
                TradeSide.BUY, new BigDecimal("10010"), book("10000", "10002"), BigDecimal.ONE, BUFFER_BPS);

        assertThat(price.getPrice()).isEqualByComparingTo("10000");
        assertThat(price.getDetails())
                .containsEntry("maker_emulation", true)
                .containsEntry("placed_price", "10000")
                .containsEntry("requested_price", "10010");
    }

    @Test
    @DisplayName("Buy below the bid is left alone")
    void buyBelowBidUnchanged() {
        MakerPrice price = MakerPriceEmulator.emulate(
                TradeSide.BUY, new BigDecimal("9990"), book("10000", "10002"), BigDecimal.ONE, BUFFER_BPS);

        assertThat(price.getPrice()).isEqualByComparingTo("9990");
    }

    @Test
    @DisplayName("Sell below the ask is clamped to the ask")
    void sellClampedToAsk() {
        MakerPrice price = MakerPriceEmulator.emulate(
                TradeSide.SELL, new BigDecimal("9990"), book("10000", "10002"), BigDecimal.ONE, BUFFER_BPS);

        assertThat(price.getPrice()).isEqualByComparingTo("10002");
    }

    @Test
    @DisplayName("Locked book pads a buy one tick under the bid")
    void lockedBookPadsByTick() {
        MakerPrice price = MakerPriceEmulator.emulate(
                TradeSide.BUY, new BigDecimal("10010"), book("10000", "10000"), new BigDecimal("5"), BUFFER_BPS);

        assertThat(price.getPrice()).isEqualByComparingTo("9995");
    }

    @Test
    @DisplayName("Without a tick the pad is the buffer in basis points")
    void lockedBookPadsByBuffer() {
        MakerPrice price = MakerPriceEmulator.emulate(
                TradeSide.SELL, new BigDecimal("9000"), book("10000", "10000"), null, BUFFER_BPS);

        assertThat(price.getPrice()).isEqualByComparingTo("10001");
        assertThat(price.getDetails()).containsEntry("tick_size", null);
    }

    @Test
    @DisplayName("Empty book keeps the requested price")
    void emptyBook() {
        MakerPrice price = MakerPriceEmulator.emulate(
                TradeSide.BUY, new BigDecimal("10010"), book(null, null), BigDecimal.ONE, BUFFER_BPS);

        assertThat(price.getPrice()).isEqualByComparingTo("10010");
    }
}
