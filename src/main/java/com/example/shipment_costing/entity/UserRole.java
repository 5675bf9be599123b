package com.example.shipment_costing.entity;

public enum UserRole {
    ADMIN,
    ACCOUNTANT,
    VIEWER
}
