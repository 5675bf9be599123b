package com.example.shipment_costing.payment;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PaymentStats(
        BigDecimal totalCostEgp,
        BigDecimal totalPaidEgp,
        BigDecimal totalBalanceEgp,
        BigDecimal totalOverpaidEgp,
        long paymentCount,
        LocalDate lastPaymentDate) {
}
