package com.example.shipment_costing.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A payment against a shipment. Never edited after insert; corrections are
 * new offsetting rows.
 */
@Entity
@Table(name = "shipment_payments")
@Getter
@Setter
@NoArgsConstructor
public class ShipmentPayment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "payment_id")
    private Long paymentId;

    @Column(name = "shipment_id", nullable = false, updatable = false)
    private Long shipmentId;

    @Column(name = "payment_date", nullable = false, updatable = false)
    private LocalDate paymentDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_currency", nullable = false, length = 10, updatable = false)
    private Currency paymentCurrency;

    @Column(name = "amount_original", nullable = false, precision = 14, scale = 2, updatable = false)
    private BigDecimal amountOriginal;

    @Column(name = "exchange_rate_to_egp", precision = 12, scale = 4, updatable = false)
    private BigDecimal exchangeRateToEgp; // null for EGP

    @Column(name = "amount_egp", nullable = false, precision = 14, scale = 2, updatable = false)
    private BigDecimal amountEgp;

    @Enumerated(EnumType.STRING)
    @Column(name = "cost_component", nullable = false, length = 30, updatable = false)
    private CostComponent costComponent;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 30, updatable = false)
    private PaymentMethod paymentMethod;

    @Column(name = "cash_receiver_name", updatable = false)
    private String cashReceiverName;

    @Column(name = "reference_number", length = 100, updatable = false)
    private String referenceNumber;

    @Column(name = "note", length = 1000, updatable = false)
    private String note;

    @Column(name = "created_by_user_id", length = 64, updatable = false)
    private String createdByUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
