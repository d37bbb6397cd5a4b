package com.tradeagent.entity;

import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.OrderType;
import com.tradeagent.domain.enums.TimeInForce;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.enums.TradingMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the order_intents table.
 * intent_json holds the canonical form that was hashed into intent_hash at creation.
 * Only status and updated_at change after insert.
 */
@Entity
@Table(name = "order_intents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderIntentEntity {

    @Id
    @Column(name = "intent_id", length = 36)
    private String intentId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(length = 30, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeSide side;

    @Column(precision = 30, scale = 12)
    private BigDecimal size;

    @Column(precision = 30, scale = 12)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", columnDefinition = "varchar(10)")
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(name = "time_in_force", columnDefinition = "varchar(10)")
    private TimeInForce timeInForce;

    @Column(length = 50)
    private String strategy;

    @Column(precision = 30, scale = 12)
    private BigDecimal confidence;

    @Column(length = 2000)
    private String rationale;

    @Column(name = "rationale_features_ref", length = 36)
    private String rationaleFeaturesRef;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradingMode mode;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private IntentStatus status;

    @Lob
    @Column(name = "intent_json")
    private String intentJson;

    @Column(name = "intent_hash", length = 64, nullable = false)
    private String intentHash;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
