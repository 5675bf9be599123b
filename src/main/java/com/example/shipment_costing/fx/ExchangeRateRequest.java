package com.example.shipment_costing.fx;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.shipment_costing.entity.Currency;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class ExchangeRateRequest {
    private LocalDate rateDate; // today when omitted

    @NotNull
    private Currency fromCurrency;

    @NotNull
    private Currency toCurrency;

    @NotNull
    @Positive
    private BigDecimal rateValue;

    private String source;
}
