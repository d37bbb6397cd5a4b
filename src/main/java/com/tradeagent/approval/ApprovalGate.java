package com.tradeagent.approval;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.model.Approval;
import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.exception.BusinessException;
import com.tradeagent.exception.ErrorCode;
import com.tradeagent.exception.ResourceNotFoundException;
import com.tradeagent.intent.CanonicalJson;
import com.tradeagent.intent.IntentHasher;
import com.tradeagent.intent.IntentService;
import com.tradeagent.observability.AuditService;
import com.tradeagent.observability.TradeAgentMetrics;
import com.tradeagent.store.TradeStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Binds a human approval phrase to one specific intent hash.
 *
 * <p>The configured target is a SHA-256 hex digest. When only a plain phrase is configured it
 * is hashed once at construction; the plain phrase is never written to storage. An approval
 * stores the intent hash as it was at approval time, and {@link #isApprovalValid} re-checks it
 * against the intent's current content, so an intent changed after approval loses its approval.
 */
@Service
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final TradeStore tradeStore;
    private final IntentService intentService;
    private final AuditService auditService;
    private final TradeAgentMetrics metrics;
    private final Clock clock;
    private final String configuredPhraseHash;

    public ApprovalGate(
            TradeStore tradeStore,
            IntentService intentService,
            AuditService auditService,
            TradeAgentMetrics metrics,
            TradeAgentProperties properties,
            Clock clock) {
        this.tradeStore = tradeStore;
        this.intentService = intentService;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
        this.configuredPhraseHash = resolvePhraseHash(properties.getTrading());
    }

    /**
     * Records an approval for the intent.
     *
     * @throws ResourceNotFoundException if no intent has this id
     * @throws BusinessException if the phrase does not match, the intent is already terminal,
     *     or its stored content no longer matches its hash
     */
    public Approval approve(String intentId, String suppliedPhrase, String approvedBy) {
        OrderIntent intent =
                tradeStore.findIntent(intentId).orElseThrow(() -> new ResourceNotFoundException("OrderIntent", intentId));

        if (intent.getStatus().isTerminal()) {
            throw new BusinessException(
                    ErrorCode.INVALID_STATE,
                    "Intent " + intentId + " is already " + intent.getStatus().wireValue(),
                    Map.of("intentId", intentId, "status", intent.getStatus().name()));
        }

        String phraseHash = hashPhrase(suppliedPhrase);
        if (!constantTimeEquals(phraseHash, configuredPhraseHash)) {
            log.warn("Approval phrase mismatch for intent {} by {}", intentId, approvedBy);
            throw new BusinessException(
                    ErrorCode.APPROVAL_REJECTED, "approval phrase mismatch", Map.of("intentId", intentId));
        }

        if (!IntentService.isIntact(intent)) {
            throw new BusinessException(
                    ErrorCode.INTEGRITY_VIOLATION, "intent hash mismatch", Map.of("intentId", intentId));
        }

        Approval approval = Approval.builder()
                .intentId(intentId)
                .intentHash(intent.getIntentHash())
                .approvedAt(clock.instant())
                .approvedBy(approvedBy)
                .phraseHash(phraseHash)
                .build();
        tradeStore.saveApproval(approval);
        if (intent.getStatus() == IntentStatus.PROPOSED) {
            intentService.transition(intentId, IntentStatus.APPROVED);
        }

        metrics.approvalGranted();
        auditService.log(
                "INTENT_APPROVED",
                "OrderIntent",
                intentId,
                Map.of("approvedBy", String.valueOf(approvedBy), "intentHash", intent.getIntentHash()));
        log.info("Intent {} approved by {}", intentId, approvedBy);
        return approval;
    }

    /** True when an approval exists and was bound to the intent's current content. */
    public boolean isApprovalValid(OrderIntent intent) {
        Optional<Approval> approval = tradeStore.findApproval(intent.getIntentId());
        return approval.isPresent() && approval.get().getIntentHash().equals(IntentHasher.hash(intent));
    }

    static String hashPhrase(String phrase) {
        String clean = phrase == null ? "" : phrase.strip();
        return CanonicalJson.sha256Hex(clean);
    }

    private static String resolvePhraseHash(TradeAgentProperties.Trading trading) {
        String configured = trading.getApprovalPhraseHash();
        if (configured != null && !configured.isBlank()) {
            return configured.strip().toLowerCase(Locale.ROOT);
        }
        return hashPhrase(trading.getApprovalPhrase());
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.US_ASCII), b.getBytes(StandardCharsets.US_ASCII));
    }
}
