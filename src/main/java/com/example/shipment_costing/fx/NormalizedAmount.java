package com.example.shipment_costing.fx;

import java.math.BigDecimal;

/**
 * A payment amount converted to EGP. {@code exchangeRateToEgp} is null for
 * EGP payments.
 */
public record NormalizedAmount(BigDecimal amountOriginal, BigDecimal amountEgp, BigDecimal exchangeRateToEgp) {
}
