package com.tradejournal.infrastructure.persistence.entity;

import com.tradejournal.domain.model.TradeSize;
import com.tradejournal.domain.model.TradeType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for exited trades
 */
@Entity
@Table(name = "closed_trade", indexes = {
    @Index(name = "idx_closed_trade_account", columnList = "account_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosedTradeEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Column(name = "entry_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal entryPrice;

    @Column(name = "exit_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal exitPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "trade_type", nullable = false, length = 20)
    private TradeType tradeType;

    @Enumerated(EnumType.STRING)
    @Column(name = "size", nullable = false, length = 20)
    private TradeSize size;

    @Column(name = "qty", nullable = false)
    private Integer qty;

    @Column(name = "entry_date", nullable = false)
    private Instant entryDate;

    @Column(name = "exit_date", nullable = false)
    private Instant exitDate;

    @Column(name = "fees", precision = 19, scale = 4)
    private BigDecimal fees;

    @Column(name = "realized_pl", nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPL;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
