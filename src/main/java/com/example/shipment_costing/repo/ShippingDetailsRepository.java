package com.example.shipment_costing.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.shipment_costing.entity.ShippingDetails;

@Repository
public interface ShippingDetailsRepository extends JpaRepository<ShippingDetails, Long> {
    Optional<ShippingDetails> findByShipmentId(Long shipmentId);

    void deleteByShipmentId(Long shipmentId);
}
