package com.example.shipment_costing.accounting;

import java.math.BigDecimal;
import java.util.List;

import com.example.shipment_costing.entity.Shipment;

public record DashboardStats(
        long totalShipments,
        BigDecimal totalCostEgp,
        BigDecimal totalPaidEgp,
        BigDecimal totalBalanceEgp,
        BigDecimal totalOverpaidEgp, // legacy rows only
        long pendingShipments,
        long completedShipments,
        List<Shipment> recentShipments) {
}
