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
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "inventory_movements")
@Getter
@Setter
@NoArgsConstructor
public class InventoryMovement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "movement_id")
    private Long movementId;

    @Column(name = "shipment_id", nullable = false)
    private Long shipmentId;

    @Column(name = "shipment_item_id", nullable = false)
    private Long shipmentItemId;

    @Column(name = "total_pieces_in", nullable = false)
    private int totalPiecesIn;

    @Column(name = "unit_cost_rmb", precision = 14, scale = 4)
    private BigDecimal unitCostRmb;

    @Column(name = "unit_cost_egp", nullable = false, precision = 14, scale = 4)
    private BigDecimal unitCostEgp;

    @Column(name = "total_cost_egp", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalCostEgp;

    @Column(name = "movement_date", nullable = false)
    private LocalDate movementDate;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (movementDate == null) movementDate = LocalDate.now();
    }
}
