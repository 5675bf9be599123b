package com.example.shipment_costing.accounting;

public enum BalanceType {
    OWING,  // cost share above payments
    CREDIT, // payments above cost share
    ALL
}
