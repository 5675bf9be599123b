package com.example.shipment_costing.entity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Data;

/**
 * Exchange rate time series. Rows are append-only: the latest row per pair is
 * the current rate.
 */
@Data
@Entity
@Table(name = "exchange_rates")
public class ExchangeRate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "rate_date", nullable = false, updatable = false)
    private LocalDate rateDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_currency", nullable = false, length = 10, updatable = false)
    private Currency fromCurrency;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_currency", nullable = false, length = 10, updatable = false)
    private Currency toCurrency;

    @Column(name = "rate_value", nullable = false, precision = 12, scale = 4, updatable = false)
    private BigDecimal rateValue;

    @Column(length = 50, updatable = false)
    private String source;

    /** Percent change against the previous row for the pair; null for the first row. */
    @Column(name = "change_percent", precision = 10, scale = 4, updatable = false)
    private BigDecimal changePercent;

    @Column(nullable = false, updatable = false)
    private boolean anomaly = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
