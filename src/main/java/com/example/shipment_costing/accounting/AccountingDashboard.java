package com.example.shipment_costing.accounting;

import java.math.BigDecimal;

public record AccountingDashboard(
        long shipmentCount,
        BigDecimal totalPurchaseRmb,
        BigDecimal totalPurchaseEgp,
        BigDecimal totalCommissionRmb,
        BigDecimal totalCommissionEgp,
        BigDecimal totalShippingRmb,
        BigDecimal totalShippingEgp,
        BigDecimal totalCustomsEgp,
        BigDecimal totalTakhreegEgp,
        BigDecimal totalCostEgp,
        BigDecimal totalPaidEgp,
        BigDecimal totalBalanceEgp,
        BigDecimal totalOverpaidEgp,
        long unsettledShipmentsCount) {
}
