package com.tradeagent.entity;

import com.tradeagent.domain.enums.ExecutionStatus;
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
 * JPA entity for the executions table.
 * details_json carries order ids, requested vs placed price, maker-emulation inputs and
 * error text.
 */
@Entity
@Table(name = "executions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionEntity {

    @Id
    @Column(name = "exec_id", length = 36)
    private String execId;

    @Column(name = "intent_id", length = 36, nullable = false)
    private String intentId;

    @Column(name = "intent_hash", length = 64)
    private String intentHash;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradingMode mode;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private ExecutionStatus status;

    @Column(precision = 30, scale = 12)
    private BigDecimal fee;

    @Column(name = "slippage_model", length = 30)
    private String slippageModel;

    @Lob
    @Column(name = "details_json")
    private String details;
}
