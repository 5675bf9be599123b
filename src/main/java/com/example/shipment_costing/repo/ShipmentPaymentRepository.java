package com.example.shipment_costing.repo;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.shipment_costing.entity.ShipmentPayment;

@Repository
public interface ShipmentPaymentRepository extends JpaRepository<ShipmentPayment, Long> {
    List<ShipmentPayment> findByShipmentIdOrderByPaymentDateDescPaymentIdDesc(Long shipmentId);

    List<ShipmentPayment> findAllByOrderByPaymentDateDescPaymentIdDesc();

    boolean existsByShipmentId(Long shipmentId);

    /**
     * Authoritative paid total and latest payment date for one shipment,
     * derived from the full payment history.
     */
    @Query("""
            SELECT COALESCE(SUM(p.amountEgp), 0) AS totalPaid,
                   MAX(p.paymentDate) AS lastDate
            FROM ShipmentPayment p
            WHERE p.shipmentId = :shipmentId
            """)
    PaymentSummary sumAndLatestDate(@Param("shipmentId") Long shipmentId);

    interface PaymentSummary {
        BigDecimal getTotalPaid();

        LocalDate getLastDate();
    }
}
