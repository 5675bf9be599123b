package com.example.shipment_costing.accounting;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record SupplierStatement(
        Long supplierId,
        String supplierName,
        LocalDate dateFrom,
        LocalDate dateTo,
        BigDecimal openingBalanceEgp,
        List<StatementLine> lines,
        BigDecimal totalDebitEgp,
        BigDecimal totalCreditEgp,
        BigDecimal closingBalanceEgp) {
}
