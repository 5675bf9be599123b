package com.example.shipment_costing.entity;

public enum Currency {
    RMB,
    EGP,
    USD
}
