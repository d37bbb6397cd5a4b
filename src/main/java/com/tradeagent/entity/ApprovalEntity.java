package com.tradeagent.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the approvals table. One approval per intent; re-approving overwrites it.
 */
@Entity
@Table(name = "approvals")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApprovalEntity {

    @Id
    @Column(name = "intent_id", length = 36)
    private String intentId;

    /** Intent hash at approval time. */
    @Column(name = "intent_hash", length = 64, nullable = false)
    private String intentHash;

    @Column(name = "approved_at", nullable = false)
    private Instant approvedAt;

    @Column(name = "approved_by", length = 100)
    private String approvedBy;

    @Column(name = "phrase_hash", length = 64, nullable = false)
    private String phraseHash;
}
