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
 * JPA entity for open trades
 */
@Entity
@Table(name = "live_trade", indexes = {
    @Index(name = "idx_live_trade_account", columnList = "account_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveTradeEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Column(name = "entry_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal entryPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "trade_type", nullable = false, length = 20)
    private TradeType tradeType;

    @Enumerated(EnumType.STRING)
    @Column(name = "size", nullable = false, length = 20)
    private TradeSize size;

    @Column(name = "qty", nullable = false)
    private Integer qty;

    @Column(name = "sl_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal slPercentage;

    @Column(name = "entry_date", nullable = false)
    private Instant entryDate;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
