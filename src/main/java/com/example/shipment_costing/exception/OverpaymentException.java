package com.example.shipment_costing.exception;

import java.math.BigDecimal;

/**
 * A payment larger than the shipment's remaining balance. Carries the
 * remaining balance so the caller can show the correct ceiling.
 */
public class OverpaymentException extends IllegalStateException {

    private final BigDecimal remainingBalanceEgp;
    private final BigDecimal attemptedAmountEgp;

    public OverpaymentException(BigDecimal remainingBalanceEgp, BigDecimal attemptedAmountEgp) {
        super(String.format("Payment of %s EGP exceeds remaining balance of %s EGP",
                attemptedAmountEgp.toPlainString(), remainingBalanceEgp.toPlainString()));
        this.remainingBalanceEgp = remainingBalanceEgp;
        this.attemptedAmountEgp = attemptedAmountEgp;
    }

    public BigDecimal getRemainingBalanceEgp() {
        return remainingBalanceEgp;
    }

    public BigDecimal getAttemptedAmountEgp() {
        return attemptedAmountEgp;
    }
}
