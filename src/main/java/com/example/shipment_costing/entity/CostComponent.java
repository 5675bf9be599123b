package com.example.shipment_costing.entity;

/**
 * Cost bucket a payment is booked against. Informational only: settlement
 * checks the shipment total, not the per-bucket remainder.
 */
public enum CostComponent {
    PURCHASE,
    SHIPPING,
    CUSTOMS_AND_TAKHREEG
}
