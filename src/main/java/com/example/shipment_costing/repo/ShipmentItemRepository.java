package com.example.shipment_costing.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.shipment_costing.entity.ShipmentItem;

@Repository
public interface ShipmentItemRepository extends JpaRepository<ShipmentItem, Long> {
    List<ShipmentItem> findByShipmentIdOrderByItemIdAsc(Long shipmentId);

    boolean existsBySupplierId(Long supplierId);

    void deleteByShipmentId(Long shipmentId);
}
