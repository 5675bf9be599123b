package com.example.shipment_costing.shipment;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Step 2 payload. Omitted rates are filled from the latest known rates and
 * then stay fixed for the shipment.
 */
@Data
public class ShippingRequest {
    @PositiveOrZero
    private BigDecimal commissionRatePercent;

    @PositiveOrZero
    private BigDecimal shippingAreaSqm;

    @PositiveOrZero
    private BigDecimal shippingCostPerSqmUsd;

    @PositiveOrZero
    private BigDecimal usdToRmbRateAtShipping;

    @PositiveOrZero
    private BigDecimal rmbToEgpRateAtShipping;

    private LocalDate shippingDate;
}
