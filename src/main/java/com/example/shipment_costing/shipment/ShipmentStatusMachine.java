package com.example.shipment_costing.shipment;

import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.example.shipment_costing.entity.ShipmentStatus;

@Component
public class ShipmentStatusMachine {

    // Allowed transitions map
    private static final Map<ShipmentStatus, Set<ShipmentStatus>> TRANSITIONS = Map.of(
            ShipmentStatus.NEW, Set.of(ShipmentStatus.AWAITING_SHIPPING, ShipmentStatus.READY_FOR_RECEIPT),
            ShipmentStatus.AWAITING_SHIPPING, Set.of(ShipmentStatus.READY_FOR_RECEIPT, ShipmentStatus.NEW),
            ShipmentStatus.READY_FOR_RECEIPT, Set.of(ShipmentStatus.RECEIVED, ShipmentStatus.AWAITING_SHIPPING,
                    ShipmentStatus.NEW),
            ShipmentStatus.RECEIVED, Set.of(ShipmentStatus.ARCHIVED),
            ShipmentStatus.ARCHIVED, Set.of(ShipmentStatus.RECEIVED) // un-archive
    );

    public void validate(ShipmentStatus from, ShipmentStatus to) {
        if (to == null) {
            throw new IllegalStateException("Target status is required");
        }
        if (from == null) {
            if (to == ShipmentStatus.NEW)
                return; // Initial
            throw new IllegalStateException("Invalid initial status: " + to);
        }

        if (from == to)
            return; // No-op transition is valid

        Set<ShipmentStatus> allowed = TRANSITIONS.get(from);
        if (allowed == null || !allowed.contains(to)) {
            throw new IllegalStateException(
                    String.format("Invalid transition: %s -> %s", from, to));
        }
    }

}
