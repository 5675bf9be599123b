package com.example.shipment_costing.security;

import com.example.shipment_costing.entity.UserRole;

import lombok.Data;

@Data
public class UserRequest {
    private String username;
    private String password;
    private String displayName;
    private UserRole role;
}
