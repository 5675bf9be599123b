package com.example.shipment_costing.payment;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.shipment_costing.entity.CostComponent;
import com.example.shipment_costing.entity.Currency;
import com.example.shipment_costing.entity.PaymentMethod;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class PaymentRequest {
    @NotNull
    private Long shipmentId;

    private LocalDate paymentDate; // today when omitted

    @NotNull
    private Currency paymentCurrency;

    @NotNull
    @Positive
    private BigDecimal amountOriginal;

    private BigDecimal exchangeRateToEgp; // required unless EGP

    @NotNull
    private CostComponent costComponent;

    @NotNull
    private PaymentMethod paymentMethod;

    @Size(max = 255)
    private String cashReceiverName;

    @Size(max = 100)
    private String referenceNumber;

    @Size(max = 1000)
    private String note;
}
