package com.example.shipment_costing.accounting;

import java.math.BigDecimal;
import java.time.LocalDate;

public record StatementLine(
        LocalDate date,
        MovementType type,
        Long shipmentId,
        String shipmentCode,
        Long paymentId,
        String description,
        BigDecimal debitEgp,
        BigDecimal creditEgp,
        BigDecimal runningBalanceEgp) {
}
