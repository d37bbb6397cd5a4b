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
 * JPA entity for the runner_state table. A single row per runner name holding the
 * serialized state.
 */
@Entity
@Table(name = "runner_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunnerStateEntity {

    @Id
    @Column(length = 50)
    private String name;

    @Lob
    @Column(name = "state_json")
    private String stateJson;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
