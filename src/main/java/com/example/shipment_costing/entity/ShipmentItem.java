package com.example.shipment_costing.entity;

import java.math.BigDecimal;
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

@Entity
@Table(name = "shipment_items")
@Getter
@Setter
@NoArgsConstructor
public class ShipmentItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "item_id")
    private Long itemId;

    @Column(name = "shipment_id", nullable = false)
    private Long shipmentId;

    @Column(name = "supplier_id")
    private Long supplierId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "product_type")
    private String productType;

    @Column(name = "country_of_origin", length = 50)
    private String countryOfOrigin;

    @Column(name = "image_url")
    private String imageUrl;

    @Column(name = "cartons", nullable = false)
    private int cartons;

    @Column(name = "pieces_per_carton", nullable = false)
    private int piecesPerCarton;

    @Column(name = "total_pieces", nullable = false)
    private int totalPieces; // cartons * piecesPerCarton

    @Column(name = "unit_price_rmb", nullable = false, precision = 14, scale = 4)
    private BigDecimal unitPriceRmb = BigDecimal.ZERO;

    @Column(name = "line_total_rmb", nullable = false, precision = 14, scale = 2)
    private BigDecimal lineTotalRmb = BigDecimal.ZERO; // totalPieces * unitPriceRmb

    @Column(name = "customs_cost_per_carton_egp", precision = 14, scale = 2)
    private BigDecimal customsCostPerCartonEgp;

    @Column(name = "takhreeg_cost_per_carton_egp", precision = 14, scale = 2)
    private BigDecimal takhreegCostPerCartonEgp;

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
