package com.example.shipment_costing.inventory;

import java.math.BigDecimal;

public record InventoryStats(long totalPieces, BigDecimal totalCostEgp, long totalItems, BigDecimal avgUnitCostEgp) {
}
