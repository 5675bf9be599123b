package com.example.shipment_costing.accounting;

import java.math.BigDecimal;
import java.util.List;

public record MovementReport(
        List<MovementLine> lines,
        BigDecimal totalCostEgp,
        BigDecimal totalPaymentsEgp,
        BigDecimal netEgp) {
}
