package com.tradeagent.entity;

import com.tradeagent.domain.enums.TradeSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the fills table. Position and average cost are rebuilt by replaying
 * these rows in timestamp order.
 */
@Entity
@Table(name = "fills")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FillEntity {

    @Id
    @Column(name = "fill_id", length = 36)
    private String fillId;

    @Column(name = "exec_id", length = 36, nullable = false)
    private String execId;

    @Column(length = 30, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeSide side;

    @Column(precision = 30, scale = 12)
    private BigDecimal size;

    @Column(precision = 30, scale = 12)
    private BigDecimal price;

    @Column(precision = 30, scale = 12)
    private BigDecimal fee;

    @Column(name = "fee_currency", length = 10)
    private String feeCurrency;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;
}
