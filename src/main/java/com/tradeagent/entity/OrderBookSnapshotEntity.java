package com.tradeagent.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the orderbook_snapshots table. Top of book only.
 */
@Entity
@Table(name = "orderbook_snapshots")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderBookSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 30, nullable = false)
    private String symbol;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @Column(precision = 30, scale = 12)
    private BigDecimal bid;

    @Column(precision = 30, scale = 12)
    private BigDecimal ask;

    @Column(name = "last_price", precision = 30, scale = 12)
    private BigDecimal lastPrice;
}
