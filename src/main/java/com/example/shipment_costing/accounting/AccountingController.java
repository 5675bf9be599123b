package com.example.shipment_costing.accounting;

import java.time.LocalDate;
import java.util.List;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.shipment_costing.entity.CostComponent;
import com.example.shipment_costing.entity.PaymentMethod;
import com.example.shipment_costing.entity.ShipmentStatus;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.payment.PaymentState;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class AccountingController {

    private final AccountingReportService reportService;

    @GetMapping("/dashboard/stats")
    public ResponseEntity<DashboardStats> dashboardStats() {
        return ResponseEntity.ok(reportService.dashboardStats());
    }

    @GetMapping("/accounting/dashboard")
    public ResponseEntity<AccountingDashboard> accountingDashboard(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(required = false) Long supplierId,
            @RequestParam(required = false) ShipmentStatus shipmentStatus,
            @RequestParam(required = false) PaymentState paymentStatus,
            @RequestParam(defaultValue = "false") boolean includeArchived) {
        ReportFilter f = filter(dateFrom, dateTo, supplierId, null, shipmentStatus, paymentStatus,
                null, null, null, null, includeArchived);
        return ResponseEntity.ok(reportService.accountingDashboard(f));
    }

    @GetMapping("/accounting/supplier-balances")
    public ResponseEntity<List<SupplierBalance>> supplierBalances(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(required = false) Long supplierId,
            @RequestParam(required = false) ShipmentStatus shipmentStatus,
            @RequestParam(required = false) PaymentState paymentStatus,
            @RequestParam(required = false) BalanceType balanceType,
            @RequestParam(defaultValue = "false") boolean includeArchived) {
        ReportFilter f = filter(dateFrom, dateTo, supplierId, null, shipmentStatus, paymentStatus,
                null, null, null, balanceType, includeArchived);
        return ResponseEntity.ok(reportService.supplierBalances(f));
    }

    @GetMapping("/accounting/supplier-statement/{supplierId}")
    public ResponseEntity<SupplierStatement> supplierStatement(
            @PathVariable Long supplierId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(defaultValue = "false") boolean includeArchived) {
        ReportFilter f = filter(dateFrom, dateTo, supplierId, null, null, null,
                null, null, null, null, includeArchived);
        return ResponseEntity.ok(reportService.supplierStatement(supplierId, f));
    }

    @GetMapping("/accounting/movement-report")
    public ResponseEntity<MovementReport> movementReport(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(required = false) Long supplierId,
            @RequestParam(required = false) Long shipmentId,
            @RequestParam(required = false) ShipmentStatus shipmentStatus,
            @RequestParam(required = false) PaymentState paymentStatus,
            @RequestParam(required = false) MovementType movementType,
            @RequestParam(required = false) CostComponent costComponent,
            @RequestParam(required = false) PaymentMethod paymentMethod,
            @RequestParam(defaultValue = "false") boolean includeArchived) {
        ReportFilter f = filter(dateFrom, dateTo, supplierId, shipmentId, shipmentStatus, paymentStatus,
                movementType, costComponent, paymentMethod, null, includeArchived);
        return ResponseEntity.ok(reportService.movementReport(f));
    }

    @GetMapping("/accounting/payment-methods-report")
    public ResponseEntity<PaymentMethodsReport> paymentMethodsReport(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(required = false) Long supplierId,
            @RequestParam(required = false) ShipmentStatus shipmentStatus,
            @RequestParam(required = false) PaymentState paymentStatus,
            @RequestParam(required = false) CostComponent costComponent,
            @RequestParam(defaultValue = "false") boolean includeArchived) {
        ReportFilter f = filter(dateFrom, dateTo, supplierId, null, shipmentStatus, paymentStatus,
                null, costComponent, null, null, includeArchived);
        return ResponseEntity.ok(reportService.paymentMethodsReport(f));
    }

    private static ReportFilter filter(LocalDate dateFrom, LocalDate dateTo, Long supplierId, Long shipmentId,
            ShipmentStatus shipmentStatus, PaymentState paymentState, MovementType movementType,
            CostComponent costComponent, PaymentMethod paymentMethod, BalanceType balanceType,
            boolean includeArchived) {
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new ValidationException("dateFrom must not be after dateTo");
        }
        return new ReportFilter(dateFrom, dateTo, supplierId, shipmentId, shipmentStatus, paymentState,
                movementType, costComponent, paymentMethod, balanceType, includeArchived);
    }
}
