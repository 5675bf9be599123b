package com.example.shipment_costing.payment;

import static com.example.shipment_costing.costing.Money.EPSILON;
import static com.example.shipment_costing.costing.Money.nz;

import java.math.BigDecimal;

/**
 * Settlement state of a shipment, derived from its cost and paid total.
 */
public enum PaymentState {
    UNPAID,
    PARTIALLY_PAID,
    SETTLED;

    public static PaymentState of(BigDecimal finalTotalCostEgp, BigDecimal totalPaidEgp) {
        BigDecimal paid = nz(totalPaidEgp);
        if (paid.signum() <= 0) {
            return UNPAID;
        }
        if (paid.compareTo(nz(finalTotalCostEgp).subtract(EPSILON)) >= 0) {
            return SETTLED;
        }
        return PARTIALLY_PAID;
    }
}
