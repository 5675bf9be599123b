package com.example.shipment_costing.inventory;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.shipment_costing.entity.InventoryMovement;
import com.example.shipment_costing.entity.Shipment;
import com.example.shipment_costing.entity.ShipmentItem;

public record InventoryView(
        Long movementId,
        Long shipmentId,
        String shipmentCode,
        Long shipmentItemId,
        String productName,
        int totalPiecesIn,
        BigDecimal unitCostRmb,
        BigDecimal unitCostEgp,
        BigDecimal totalCostEgp,
        LocalDate movementDate) {

    static InventoryView of(InventoryMovement m, Shipment s, ShipmentItem item) {
        return new InventoryView(
                m.getMovementId(),
                m.getShipmentId(),
                s == null ? null : s.getShipmentCode(),
                m.getShipmentItemId(),
                item == null ? null : item.getProductName(),
                m.getTotalPiecesIn(),
                m.getUnitCostRmb(),
                m.getUnitCostEgp(),
                m.getTotalCostEgp(),
                m.getMovementDate());
    }
}
