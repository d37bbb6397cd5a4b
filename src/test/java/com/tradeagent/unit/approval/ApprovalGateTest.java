package com.tradeagent.unit.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import com.tradeagent.approval.ApprovalGate;
import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.Approval;
import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.exception.BusinessException;
import com.tradeagent.exception.ErrorCode;
import com.tradeagent.exception.ResourceNotFoundException;
import com.tradeagent.intent.CanonicalJson;
import com.tradeagent.intent.IntentFactory;
import com.tradeagent.intent.IntentService;
import com.tradeagent.observability.AuditService;
import com.tradeagent.observability.TradeAgentMetrics;
import com.tradeagent.support.InMemoryTradeStore;
import com.tradeagent.support.MutableClock;
import com.tradeagent.support.TestData;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for ApprovalGate: phrase matching against the configured hash, binding to the
 * intent hash, and invalidation when the stored intent changes after approval.
 */
@ExtendWith(MockitoExtension.class)
class ApprovalGateTest {

    private static final String PHRASE = "I APPROVE";

    @Mock
    private AuditService auditService;

    private InMemoryTradeStore tradeStore;
    private IntentService intentService;
    private TradeAgentProperties properties;
    private MutableClock clock;
    private OrderIntent intent;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-10T12:00:00Z"));
        tradeStore = new InMemoryTradeStore();
        TradeAgentMetrics metrics = new TradeAgentMetrics(new SimpleMeterRegistry());
        intentService = new IntentService(new IntentFactory(clock), tradeStore, auditService, metrics);
        properties = new TradeAgentProperties();
        properties.getTrading().setApprovalPhrase(PHRASE);
        intent = intentService.propose(TestData.plan(TradeSide.BUY, "1", "1000"), TradingMode.PAPER, 900, null);
    }

    private ApprovalGate gate() {
        return new ApprovalGate(
                tradeStore, intentService, auditService, new TradeAgentMetrics(new SimpleMeterRegistry()), properties, clock);
    }

    // ==============================
    // APPROVE
    // ==============================

    @Nested
    @DisplayName("Approve")
    class Approve {

        @Test
        @DisplayName("Matching phrase records an approval bound to the intent hash")
        void matchingPhrase() {
            Approval approval = gate().approve(intent.getIntentId(), PHRASE, "alice");

            assertThat(approval.getIntentHash()).isEqualTo(intent.getIntentHash());
            assertThat(approval.getPhraseHash()).isEqualTo(CanonicalJson.sha256Hex(PHRASE));
            assertThat(tradeStore.findIntent(intent.getIntentId()).orElseThrow().getStatus())
                    .isEqualTo(IntentStatus.APPROVED);
            verify(auditService).log(eq("INTENT_APPROVED"), eq("OrderIntent"), eq(intent.getIntentId()), any());
        }

        @Test
        @DisplayName("Surrounding whitespace in the phrase is ignored")
        void phraseStripped() {
            Approval approval = gate().approve(intent.getIntentId(), "  I APPROVE \n", "alice");

            assertThat(approval).isNotNull();
        }

        @Test
        @DisplayName("Configured hash takes precedence over the plain phrase")
        void configuredHash() {
            properties.getTrading().setApprovalPhraseHash(CanonicalJson.sha256Hex("ship it").toUpperCase());

            Approval approval = gate().approve(intent.getIntentId(), "ship it", "bob");

            assertThat(approval.getApprovedBy()).isEqualTo("bob");
        }

        @Test
        @DisplayName("Wrong phrase is refused and nothing is stored")
        void wrongPhrase() {
            assertThatThrownBy(() -> gate().approve(intent.getIntentId(), "i approve", "alice"))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.APPROVAL_REJECTED));

            assertThat(tradeStore.findApproval(intent.getIntentId())).isEmpty();
            assertThat(tradeStore.findIntent(intent.getIntentId()).orElseThrow().getStatus())
                    .isEqualTo(IntentStatus.PROPOSED);
        }

        @Test
        @DisplayName("Unknown intent is not found")
        void unknownIntent() {
            assertThatThrownBy(() -> gate().approve("missing", PHRASE, "alice"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Terminal intent cannot be approved")
        void terminalIntent() {
            tradeStore.updateIntentStatus(intent.getIntentId(), IntentStatus.EXPIRED);

            assertThatThrownBy(() -> gate().approve(intent.getIntentId(), PHRASE, "alice"))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("expired");
        }

        @Test
        @DisplayName("Tampered intent cannot be approved")
        void tamperedIntent() {
            tradeStore.overwriteIntent(intent.toBuilder().size(new BigDecimal("9.0")).build());

            assertThatThrownBy(() -> gate().approve(intent.getIntentId(), PHRASE, "alice"))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("hash mismatch");
        }
    }

    // ==============================
    // VALIDITY
    // ==============================

    @Nested
    @DisplayName("Approval validity")
    class Validity {

        @Test
        @DisplayName("Approval is valid for the intent it was granted on")
        void validForApprovedIntent() {
            ApprovalGate gate = gate();
            gate.approve(intent.getIntentId(), PHRASE, "alice");

            OrderIntent stored = tradeStore.findIntent(intent.getIntentId()).orElseThrow();

            assertThat(gate.isApprovalValid(stored)).isTrue();
        }

        @Test
        @DisplayName("Changing the intent after approval invalidates the approval")
        void invalidAfterChange() {
            ApprovalGate gate = gate();
            gate.approve(intent.getIntentId(), PHRASE, "alice");

            OrderIntent changed = intent.toBuilder().price(new BigDecimal("999.0")).build();

            assertThat(gate.isApprovalValid(changed)).isFalse();
        }

        @Test
        @DisplayName("No approval means not valid")
        void noApproval() {
            assertThat(gate().isApprovalValid(intent)).isFalse();
        }
    }
}
