package com.example.shipment_costing.shipment;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class ItemRequest {
    private Long itemId; // null for a new item

    private Long supplierId;

    @NotBlank
    private String productName;

    private String productType;
    private String countryOfOrigin;
    private String imageUrl;

    @PositiveOrZero
    private int cartons;

    @PositiveOrZero
    private int piecesPerCarton;

    @PositiveOrZero
    private BigDecimal unitPriceRmb;

    @PositiveOrZero
    private BigDecimal customsCostPerCartonEgp;

    @PositiveOrZero
    private BigDecimal takhreegCostPerCartonEgp;
}
