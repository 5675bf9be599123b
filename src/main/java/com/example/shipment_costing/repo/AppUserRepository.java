package com.example.shipment_costing.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.shipment_costing.entity.AppUser;
import com.example.shipment_costing.entity.UserRole;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {
    Optional<AppUser> findByUsername(String username);

    long countByRole(UserRole role);
}
