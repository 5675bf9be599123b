package com.example.shipment_costing.shipment;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.example.shipment_costing.entity.ShipmentStatus;

class ShipmentStatusMachineTest {

    private final ShipmentStatusMachine machine = new ShipmentStatusMachine();

    @Test
    void forwardPathIsAllowed() {
        assertDoesNotThrow(() -> machine.validate(ShipmentStatus.NEW, ShipmentStatus.AWAITING_SHIPPING));
        assertDoesNotThrow(() -> machine.validate(ShipmentStatus.AWAITING_SHIPPING, ShipmentStatus.READY_FOR_RECEIPT));
        assertDoesNotThrow(() -> machine.validate(ShipmentStatus.NEW, ShipmentStatus.READY_FOR_RECEIPT));
        assertDoesNotThrow(() -> machine.validate(ShipmentStatus.READY_FOR_RECEIPT, ShipmentStatus.RECEIVED));
        assertDoesNotThrow(() -> machine.validate(ShipmentStatus.RECEIVED, ShipmentStatus.ARCHIVED));
    }

    @Test
    void stepBackBeforeReceiptAndUnarchive() {
        assertDoesNotThrow(() -> machine.validate(ShipmentStatus.READY_FOR_RECEIPT, ShipmentStatus.NEW));
        assertDoesNotThrow(() -> machine.validate(ShipmentStatus.AWAITING_SHIPPING, ShipmentStatus.NEW));
        assertDoesNotThrow(() -> machine.validate(ShipmentStatus.ARCHIVED, ShipmentStatus.RECEIVED));
    }

    @Test
    void skippingShippingOrLeavingReceivedIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> machine.validate(ShipmentStatus.NEW, ShipmentStatus.RECEIVED));
        assertThrows(IllegalStateException.class,
                () -> machine.validate(ShipmentStatus.RECEIVED, ShipmentStatus.NEW));
        assertThrows(IllegalStateException.class,
                () -> machine.validate(ShipmentStatus.ARCHIVED, ShipmentStatus.NEW));
        assertThrows(IllegalStateException.class,
                () -> machine.validate(ShipmentStatus.NEW, ShipmentStatus.ARCHIVED));
    }

    @Test
    void selfTransitionIsNoOp() {
        for (ShipmentStatus s : ShipmentStatus.values()) {
            assertDoesNotThrow(() -> machine.validate(s, s));
        }
    }

    @Test
    void initialStatusMustBeNew() {
        assertDoesNotThrow(() -> machine.validate(null, ShipmentStatus.NEW));
        assertThrows(IllegalStateException.class, () -> machine.validate(null, ShipmentStatus.RECEIVED));
    }
}
