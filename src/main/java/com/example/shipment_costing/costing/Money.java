package com.example.shipment_costing.costing;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point money helpers. Amounts are kept at 2 decimals, rates at 4,
 * both rounded half-up.
 */
public final class Money {

    public static final BigDecimal EPSILON = new BigDecimal("0.0001");
    public static final BigDecimal HUNDRED = new BigDecimal("100");

    private Money() {
    }

    public static BigDecimal nz(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }

    public static BigDecimal round2(BigDecimal v) {
        return nz(v).setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal round4(BigDecimal v) {
        return nz(v).setScale(4, RoundingMode.HALF_UP);
    }

    public static boolean isPositive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }

    /** max(0, cost - paid), rounded to 2 decimals. */
    public static BigDecimal balance(BigDecimal cost, BigDecimal paid) {
        return round2(nz(cost).subtract(nz(paid)).max(BigDecimal.ZERO));
    }

    /** max(0, paid - cost): overpayment carried by legacy rows, never created by settlement. */
    public static BigDecimal overpaid(BigDecimal cost, BigDecimal paid) {
        return round2(nz(paid).subtract(nz(cost)).max(BigDecimal.ZERO));
    }
}
