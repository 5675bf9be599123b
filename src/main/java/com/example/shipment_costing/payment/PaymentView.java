package com.example.shipment_costing.payment;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.shipment_costing.entity.CostComponent;
import com.example.shipment_costing.entity.Currency;
import com.example.shipment_costing.entity.PaymentMethod;
import com.example.shipment_costing.entity.Shipment;
import com.example.shipment_costing.entity.ShipmentPayment;

/**
 * A payment row joined with its shipment's code and name.
 */
public record PaymentView(
        Long paymentId,
        Long shipmentId,
        String shipmentCode,
        String shipmentName,
        LocalDate paymentDate,
        Currency paymentCurrency,
        BigDecimal amountOriginal,
        BigDecimal exchangeRateToEgp,
        BigDecimal amountEgp,
        CostComponent costComponent,
        PaymentMethod paymentMethod,
        String cashReceiverName,
        String referenceNumber,
        String note) {

    static PaymentView of(ShipmentPayment p, Shipment s) {
        return new PaymentView(
                p.getPaymentId(),
                p.getShipmentId(),
                s == null ? null : s.getShipmentCode(),
                s == null ? null : s.getShipmentName(),
                p.getPaymentDate(),
                p.getPaymentCurrency(),
                p.getAmountOriginal(),
                p.getExchangeRateToEgp(),
                p.getAmountEgp(),
                p.getCostComponent(),
                p.getPaymentMethod(),
                p.getCashReceiverName(),
                p.getReferenceNumber(),
                p.getNote());
    }
}
