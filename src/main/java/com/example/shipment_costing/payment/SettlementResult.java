package com.example.shipment_costing.payment;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.shipment_costing.entity.ShipmentPayment;

public record SettlementResult(
        ShipmentPayment payment,
        Long shipmentId,
        BigDecimal finalTotalCostEgp,
        BigDecimal totalPaidEgp,
        BigDecimal balanceEgp,
        LocalDate lastPaymentDate,
        PaymentState paymentState) {
}
