package com.tradeagent.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the feature_snapshots table.
 * Captures the feature vector a strategy saw when it produced a plan; intents point at it
 * through rationale_features_ref.
 */
@Entity
@Table(name = "feature_snapshots")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeatureSnapshotEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 30)
    private String symbol;

    @Column(name = "ts")
    private Instant timestamp;

    @Lob
    @Column(name = "features_json")
    private String featuresJson;
}
