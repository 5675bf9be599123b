package com.example.shipment_costing.shipment;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class CustomsRequest {
    @NotNull
    private Long itemId;

    @PositiveOrZero
    private BigDecimal customsCostPerCartonEgp;

    @PositiveOrZero
    private BigDecimal takhreegCostPerCartonEgp;
}
