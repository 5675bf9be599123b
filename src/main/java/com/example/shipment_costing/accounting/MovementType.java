package com.example.shipment_costing.accounting;

public enum MovementType {
    SHIPMENT_COST,
    PAYMENT
}
