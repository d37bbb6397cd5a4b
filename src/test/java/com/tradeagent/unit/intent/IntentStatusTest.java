package com.tradeagent.unit.intent;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeagent.domain.enums.IntentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class IntentStatusTest {

    @Test
    @DisplayName("PROPOSED may move anywhere else")
    void proposedMovesAnywhere() {
        for (IntentStatus target : IntentStatus.values()) {
            assertThat(IntentStatus.PROPOSED.canTransitionTo(target)).isEqualTo(target != IntentStatus.PROPOSED);
        }
    }

    @Test
    @DisplayName("APPROVED never goes back to PROPOSED")
    void approvedForwardOnly() {
        assertThat(IntentStatus.APPROVED.canTransitionTo(IntentStatus.PROPOSED)).isFalse();
        assertThat(IntentStatus.APPROVED.canTransitionTo(IntentStatus.OPEN)).isTrue();
        assertThat(IntentStatus.APPROVED.canTransitionTo(IntentStatus.FILLED)).isTrue();
    }

    @Test
    @DisplayName("OPEN moves only to FILLED, CANCELED, EXPIRED or ERROR")
    void openTransitions() {
        assertThat(IntentStatus.OPEN.canTransitionTo(IntentStatus.FILLED)).isTrue();
        assertThat(IntentStatus.OPEN.canTransitionTo(IntentStatus.CANCELED)).isTrue();
        assertThat(IntentStatus.OPEN.canTransitionTo(IntentStatus.EXPIRED)).isTrue();
        assertThat(IntentStatus.OPEN.canTransitionTo(IntentStatus.ERROR)).isTrue();
        assertThat(IntentStatus.OPEN.canTransitionTo(IntentStatus.APPROVED)).isFalse();
        assertThat(IntentStatus.OPEN.canTransitionTo(IntentStatus.REJECTED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = IntentStatus.class, names = {"FILLED", "REJECTED", "EXPIRED", "ERROR", "CANCELED"})
    @DisplayName("Terminal statuses never move again")
    void terminalIsFinal(IntentStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (IntentStatus target : IntentStatus.values()) {
            assertThat(terminal.canTransitionTo(target)).isFalse();
        }
    }
}
