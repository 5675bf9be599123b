package com.example.shipment_costing.accounting;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.shipment_costing.entity.CostComponent;
import com.example.shipment_costing.entity.Currency;
import com.example.shipment_costing.entity.PaymentMethod;

public record MovementLine(
        LocalDate date,
        MovementType movementType,
        Long shipmentId,
        String shipmentCode,
        String shipmentName,
        Long paymentId,
        CostComponent costComponent, // null on a full shipment cost line
        PaymentMethod paymentMethod,
        Currency currency,
        BigDecimal amountOriginal,
        BigDecimal amountEgp) {
}
