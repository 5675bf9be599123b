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
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "shipments")
@Getter
@Setter
@NoArgsConstructor
public class Shipment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "shipment_id")
    private Long shipmentId;

    @Column(name = "shipment_code", nullable = false, unique = true, length = 50)
    private String shipmentCode;

    @Column(name = "shipment_name", nullable = false)
    private String shipmentName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private ShipmentStatus status = ShipmentStatus.NEW;

    @Column(name = "purchase_date")
    private LocalDate purchaseDate;

    @Column(name = "purchase_cost_rmb", nullable = false, precision = 14, scale = 2)
    private BigDecimal purchaseCostRmb = BigDecimal.ZERO;

    @Column(name = "purchase_cost_egp", nullable = false, precision = 14, scale = 2)
    private BigDecimal purchaseCostEgp = BigDecimal.ZERO;

    @Column(name = "commission_cost_rmb", nullable = false, precision = 14, scale = 2)
    private BigDecimal commissionCostRmb = BigDecimal.ZERO;

    @Column(name = "commission_cost_egp", nullable = false, precision = 14, scale = 2)
    private BigDecimal commissionCostEgp = BigDecimal.ZERO;

    @Column(name = "shipping_cost_usd", nullable = false, precision = 14, scale = 2)
    private BigDecimal shippingCostUsd = BigDecimal.ZERO;

    @Column(name = "shipping_cost_rmb", nullable = false, precision = 14, scale = 2)
    private BigDecimal shippingCostRmb = BigDecimal.ZERO;

    @Column(name = "shipping_cost_egp", nullable = false, precision = 14, scale = 2)
    private BigDecimal shippingCostEgp = BigDecimal.ZERO;

    @Column(name = "customs_cost_egp", nullable = false, precision = 14, scale = 2)
    private BigDecimal customsCostEgp = BigDecimal.ZERO;

    @Column(name = "takhreeg_cost_egp", nullable = false, precision = 14, scale = 2)
    private BigDecimal takhreegCostEgp = BigDecimal.ZERO;

    @Column(name = "final_total_cost_egp", nullable = false, precision = 14, scale = 2)
    private BigDecimal finalTotalCostEgp = BigDecimal.ZERO;

    @Column(name = "total_paid_egp", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalPaidEgp = BigDecimal.ZERO;

    @Column(name = "balance_egp", nullable = false, precision = 14, scale = 2)
    private BigDecimal balanceEgp = BigDecimal.ZERO;

    @Column(name = "last_payment_date")
    private LocalDate lastPaymentDate;

    /** true while purchase EGP is estimated from the latest rate (no shipping details yet). */
    @Column(name = "cost_preliminary", nullable = false)
    private boolean costPreliminary = true;

    @Column(name = "created_by_user_id", length = 64)
    private String createdByUserId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
