package com.example.shipment_costing.entity;

public enum PaymentMethod {
    CASH,
    VODAFONE_CASH,
    INSTAPAY,
    BANK_TRANSFER,
    OTHER
}
