package com.example.shipment_costing.accounting;

import java.math.BigDecimal;

/**
 * balanceEgp is cost share minus paid share: positive means owing, negative
 * means credit.
 */
public record SupplierBalance(
        Long supplierId,
        String supplierName,
        long shipmentCount,
        BigDecimal totalCostEgp,
        BigDecimal totalPaidEgp,
        BigDecimal balanceEgp) {
}
