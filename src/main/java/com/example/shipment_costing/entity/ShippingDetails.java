package com.example.shipment_costing.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Shipping inputs of one shipment. The two rates are snapshots taken when the
 * goods shipped; later rate changes never touch them.
 */
@Entity
@Table(name = "shipment_shipping_details")
@Getter
@Setter
@NoArgsConstructor
public class ShippingDetails {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "shipping_details_id")
    private Long shippingDetailsId;

    @Column(name = "shipment_id", nullable = false, unique = true)
    private Long shipmentId;

    @Column(name = "commission_rate_percent", precision = 7, scale = 4)
    private BigDecimal commissionRatePercent;

    @Column(name = "shipping_area_sqm", precision = 12, scale = 4)
    private BigDecimal shippingAreaSqm;

    @Column(name = "shipping_cost_per_sqm_usd", precision = 12, scale = 4)
    private BigDecimal shippingCostPerSqmUsd;

    @Column(name = "usd_to_rmb_rate_at_shipping", precision = 12, scale = 4)
    private BigDecimal usdToRmbRateAtShipping;

    @Column(name = "rmb_to_egp_rate_at_shipping", precision = 12, scale = 4)
    private BigDecimal rmbToEgpRateAtShipping;

    @Column(name = "shipping_date")
    private LocalDate shippingDate;

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
