package com.example.shipment_costing.accounting;

import java.math.BigDecimal;
import java.util.List;

import com.example.shipment_costing.entity.PaymentMethod;

public record PaymentMethodsReport(List<MethodTotal> methods, long totalCount, BigDecimal totalEgp) {

    public record MethodTotal(PaymentMethod paymentMethod, long count, BigDecimal totalEgp, BigDecimal sharePercent) {
    }
}
