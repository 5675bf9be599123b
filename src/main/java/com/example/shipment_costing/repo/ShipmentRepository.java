package com.example.shipment_costing.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.shipment_costing.entity.Shipment;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;

@Repository
public interface ShipmentRepository extends JpaRepository<Shipment, Long> {

    /**
     * SELECT ... FOR UPDATE on the shipment row. Held until the surrounding
     * transaction commits or rolls back.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT s FROM Shipment s WHERE s.shipmentId = :id")
    Optional<Shipment> findByIdForUpdate(@Param("id") Long id);

    boolean existsByShipmentCode(String shipmentCode);

    List<Shipment> findAllByOrderByCreatedAtDesc();
}
