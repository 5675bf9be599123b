package com.example.shipment_costing.entity;

/**
 * Shipment lifecycle, in wizard order.
 */
public enum ShipmentStatus {
    NEW,
    AWAITING_SHIPPING,
    READY_FOR_RECEIPT,
    RECEIVED,
    ARCHIVED
}
