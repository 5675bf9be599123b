package com.example.shipment_costing.fx;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Latest known rates, read once and handed to the cost aggregator.
 */
public record RateSnapshot(BigDecimal rmbToEgp, BigDecimal usdToRmb, LocalDate asOf) {
}
