package com.example.shipment_costing.accounting;

import java.time.LocalDate;

import com.example.shipment_costing.entity.CostComponent;
import com.example.shipment_costing.entity.PaymentMethod;
import com.example.shipment_costing.entity.ShipmentStatus;
import com.example.shipment_costing.payment.PaymentState;

/**
 * Common report filter. Every field is optional; ARCHIVED shipments are left
 * out unless {@code includeArchived} is set.
 */
public record ReportFilter(
        LocalDate dateFrom,
        LocalDate dateTo,
        Long supplierId,
        Long shipmentId,
        ShipmentStatus shipmentStatus,
        PaymentState paymentState,
        MovementType movementType,
        CostComponent costComponent,
        PaymentMethod paymentMethod,
        BalanceType balanceType,
        boolean includeArchived) {

    public static ReportFilter none() {
        return new ReportFilter(null, null, null, null, null, null, null, null, null, null, false);
    }

    public boolean inRange(LocalDate date) {
        if (date == null) {
            return dateFrom == null && dateTo == null;
        }
        if (dateFrom != null && date.isBefore(dateFrom)) {
            return false;
        }
        return dateTo == null || !date.isAfter(dateTo);
    }

    public BalanceType balanceTypeOrAll() {
        return balanceType == null ? BalanceType.ALL : balanceType;
    }
}
