package com.example.shipment_costing.security;

import java.time.LocalDateTime;

import com.example.shipment_costing.entity.AppUser;
import com.example.shipment_costing.entity.UserRole;

/**
 * AppUser without the password hash.
 */
public record UserView(Long userId, String username, UserRole role, String displayName, LocalDateTime createdAt) {

    static UserView of(AppUser u) {
        return new UserView(u.getUserId(), u.getUsername(), u.getRole(), u.getDisplayName(), u.getCreatedAt());
    }
}
