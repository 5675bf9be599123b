package com.example.shipment_costing.accounting;

import static com.example.shipment_costing.costing.Money.HUNDRED;
import static com.example.shipment_costing.costing.Money.nz;
import static com.example.shipment_costing.costing.Money.round2;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.shipment_costing.costing.Money;
import com.example.shipment_costing.entity.CostComponent;
import com.example.shipment_costing.entity.PaymentMethod;
import com.example.shipment_costing.entity.Shipment;
import com.example.shipment_costing.entity.ShipmentItem;
import com.example.shipment_costing.entity.ShipmentPayment;
import com.example.shipment_costing.entity.ShipmentStatus;
import com.example.shipment_costing.entity.Supplier;
import com.example.shipment_costing.exception.NotFoundException;
import com.example.shipment_costing.payment.PaymentState;
import com.example.shipment_costing.repo.ShipmentItemRepository;
import com.example.shipment_costing.repo.ShipmentPaymentRepository;
import com.example.shipment_costing.repo.ShipmentRepository;
import com.example.shipment_costing.repo.SupplierRepository;

import lombok.RequiredArgsConstructor;

/**
 * Read-only views over shipments, items and payments.
 *
 * A supplier's share of a shipment is the supplier's line total RMB divided
 * by the shipment's purchase RMB. Supplier reports (and the movement report
 * when filtered by supplier) scale shipment cost and payments by that share.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AccountingReportService {

    private static final int RECENT_LIMIT = 5;
    private static final int WEIGHT_SCALE = 10;

    private final ShipmentRepository shipmentRepo;
    private final ShipmentItemRepository itemRepo;
    private final ShipmentPaymentRepository paymentRepo;
    private final SupplierRepository supplierRepo;

    public DashboardStats dashboardStats() {
        List<Shipment> all = shipmentRepo.findAllByOrderByCreatedAtDesc();
        BigDecimal cost = BigDecimal.ZERO;
        BigDecimal paid = BigDecimal.ZERO;
        BigDecimal balance = BigDecimal.ZERO;
        BigDecimal overpaid = BigDecimal.ZERO;
        long pending = 0;
        long completed = 0;
        for (Shipment s : all) {
            cost = cost.add(nz(s.getFinalTotalCostEgp()));
            paid = paid.add(nz(s.getTotalPaidEgp()));
            balance = balance.add(Money.balance(s.getFinalTotalCostEgp(), s.getTotalPaidEgp()));
            overpaid = overpaid.add(Money.overpaid(s.getFinalTotalCostEgp(), s.getTotalPaidEgp()));
            if (s.getStatus() == ShipmentStatus.RECEIVED || s.getStatus() == ShipmentStatus.ARCHIVED) {
                completed++;
            } else {
                pending++;
            }
        }
        return new DashboardStats(all.size(), round2(cost), round2(paid), round2(balance), round2(overpaid),
                pending, completed, all.stream().limit(RECENT_LIMIT).toList());
    }

    public AccountingDashboard accountingDashboard(ReportFilter filter) {
        ReportFilter f = filter == null ? ReportFilter.none() : filter;
        Map<Long, List<ShipmentItem>> items = itemsByShipment();
        List<Shipment> shipments = shipments(f, items, true);

        BigDecimal purchaseRmb = BigDecimal.ZERO, purchaseEgp = BigDecimal.ZERO;
        BigDecimal commissionRmb = BigDecimal.ZERO, commissionEgp = BigDecimal.ZERO;
        BigDecimal shippingRmb = BigDecimal.ZERO, shippingEgp = BigDecimal.ZERO;
        BigDecimal customs = BigDecimal.ZERO, takhreeg = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO, paid = BigDecimal.ZERO;
        BigDecimal balance = BigDecimal.ZERO, overpaid = BigDecimal.ZERO;
        long unsettled = 0;
        for (Shipment s : shipments) {
            purchaseRmb = purchaseRmb.add(nz(s.getPurchaseCostRmb()));
            purchaseEgp = purchaseEgp.add(nz(s.getPurchaseCostEgp()));
            commissionRmb = commissionRmb.add(nz(s.getCommissionCostRmb()));
            commissionEgp = commissionEgp.add(nz(s.getCommissionCostEgp()));
            shippingRmb = shippingRmb.add(nz(s.getShippingCostRmb()));
            shippingEgp = shippingEgp.add(nz(s.getShippingCostEgp()));
            customs = customs.add(nz(s.getCustomsCostEgp()));
            takhreeg = takhreeg.add(nz(s.getTakhreegCostEgp()));
            cost = cost.add(nz(s.getFinalTotalCostEgp()));
            paid = paid.add(nz(s.getTotalPaidEgp()));
            BigDecimal b = Money.balance(s.getFinalTotalCostEgp(), s.getTotalPaidEgp());
            balance = balance.add(b);
            overpaid = overpaid.add(Money.overpaid(s.getFinalTotalCostEgp(), s.getTotalPaidEgp()));
            if (b.signum() > 0) {
                unsettled++;
            }
        }
        return new AccountingDashboard(shipments.size(),
                round2(purchaseRmb), round2(purchaseEgp),
                round2(commissionRmb), round2(commissionEgp),
                round2(shippingRmb), round2(shippingEgp),
                round2(customs), round2(takhreeg),
                round2(cost), round2(paid), round2(balance), round2(overpaid),
                unsettled);
    }

    public List<SupplierBalance> supplierBalances(ReportFilter filter) {
        ReportFilter f = filter == null ? ReportFilter.none() : filter;
        Map<Long, List<ShipmentItem>> items = itemsByShipment();
        List<Shipment> shipments = shipments(f, items, true);

        List<Supplier> suppliers = f.supplierId() != null
                ? supplierRepo.findById(f.supplierId()).map(List::of).orElse(List.of())
                : supplierRepo.findAll();

        List<SupplierBalance> out = new ArrayList<>();
        for (Supplier supplier : suppliers) {
            long count = 0;
            BigDecimal cost = BigDecimal.ZERO;
            BigDecimal paid = BigDecimal.ZERO;
            for (Shipment s : shipments) {
                BigDecimal w = supplierWeight(supplier.getSupplierId(), items.get(s.getShipmentId()));
                if (w.signum() == 0) {
                    continue;
                }
                count++;
                cost = cost.add(nz(s.getFinalTotalCostEgp()).multiply(w));
                paid = paid.add(nz(s.getTotalPaidEgp()).multiply(w));
            }
            BigDecimal costR = round2(cost);
            BigDecimal paidR = round2(paid);
            BigDecimal balance = costR.subtract(paidR);
            boolean keep = switch (f.balanceTypeOrAll()) {
                case OWING -> balance.signum() > 0;
                case CREDIT -> balance.signum() < 0;
                case ALL -> true;
            };
            if (keep) {
                out.add(new SupplierBalance(supplier.getSupplierId(), supplier.getName(), count, costR, paidR,
                        balance));
            }
        }
        return out;
    }

    public SupplierStatement supplierStatement(Long supplierId, ReportFilter filter) {
        ReportFilter f = filter == null ? ReportFilter.none() : filter;
        Supplier supplier = supplierRepo.findById(supplierId)
                .orElseThrow(() -> new NotFoundException("Supplier", supplierId));
        Map<Long, List<ShipmentItem>> items = itemsByShipment();
        Map<Long, List<ShipmentPayment>> payments = paymentsByShipment();

        List<StatementLine> raw = new ArrayList<>();
        for (Shipment s : shipments(f, items, false)) {
            BigDecimal w = supplierWeight(supplierId, items.get(s.getShipmentId()));
            if (w.signum() == 0) {
                continue;
            }
            raw.add(new StatementLine(shipmentDate(s), MovementType.SHIPMENT_COST, s.getShipmentId(),
                    s.getShipmentCode(), null, "Shipment " + s.getShipmentCode(),
                    round2(nz(s.getFinalTotalCostEgp()).multiply(w)), round2(BigDecimal.ZERO), null));
            for (ShipmentPayment p : payments.getOrDefault(s.getShipmentId(), List.of())) {
                raw.add(new StatementLine(p.getPaymentDate(), MovementType.PAYMENT, s.getShipmentId(),
                        s.getShipmentCode(), p.getPaymentId(),
                        "Payment " + p.getPaymentMethod() + " (" + p.getCostComponent() + ")",
                        round2(BigDecimal.ZERO), round2(nz(p.getAmountEgp()).multiply(w)), null));
            }
        }
        raw.sort(Comparator.comparing(StatementLine::date, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(StatementLine::type)
                .thenComparing(StatementLine::shipmentId)
                .thenComparing(StatementLine::paymentId, Comparator.nullsFirst(Comparator.naturalOrder())));

        BigDecimal opening = BigDecimal.ZERO;
        BigDecimal running;
        BigDecimal debit = BigDecimal.ZERO;
        BigDecimal credit = BigDecimal.ZERO;
        List<StatementLine> period = new ArrayList<>();
        for (StatementLine l : raw) {
            if (f.dateFrom() != null && l.date() != null && l.date().isBefore(f.dateFrom())) {
                opening = opening.add(l.debitEgp()).subtract(l.creditEgp());
            }
        }
        running = opening;
        for (StatementLine l : raw) {
            if (f.dateFrom() != null && l.date() != null && l.date().isBefore(f.dateFrom())) {
                continue;
            }
            if (f.dateTo() != null && l.date() != null && l.date().isAfter(f.dateTo())) {
                continue;
            }
            running = running.add(l.debitEgp()).subtract(l.creditEgp());
            debit = debit.add(l.debitEgp());
            credit = credit.add(l.creditEgp());
            period.add(new StatementLine(l.date(), l.type(), l.shipmentId(), l.shipmentCode(), l.paymentId(),
                    l.description(), l.debitEgp(), l.creditEgp(), round2(running)));
        }
        return new SupplierStatement(supplier.getSupplierId(), supplier.getName(), f.dateFrom(), f.dateTo(),
                round2(opening), period, round2(debit), round2(credit), round2(running));
    }

    public MovementReport movementReport(ReportFilter filter) {
        ReportFilter f = filter == null ? ReportFilter.none() : filter;
        Map<Long, List<ShipmentItem>> items = itemsByShipment();
        Map<Long, List<ShipmentPayment>> payments = paymentsByShipment();

        List<MovementLine> lines = new ArrayList<>();
        BigDecimal costTotal = BigDecimal.ZERO;
        BigDecimal paymentTotal = BigDecimal.ZERO;
        boolean costLines = f.paymentMethod() == null
                && (f.movementType() == null || f.movementType() == MovementType.SHIPMENT_COST);
        boolean paymentLines = f.movementType() == null || f.movementType() == MovementType.PAYMENT;

        for (Shipment s : shipments(f, items, false)) {
            BigDecimal w = f.supplierId() == null ? BigDecimal.ONE
                    : supplierWeight(f.supplierId(), items.get(s.getShipmentId()));
            if (costLines && f.inRange(shipmentDate(s))) {
                BigDecimal amount = round2(componentCost(s, f.costComponent()).multiply(w));
                lines.add(new MovementLine(shipmentDate(s), MovementType.SHIPMENT_COST, s.getShipmentId(),
                        s.getShipmentCode(), s.getShipmentName(), null, f.costComponent(), null, null, null,
                        amount));
                costTotal = costTotal.add(amount);
            }
            if (!paymentLines) {
                continue;
            }
            for (ShipmentPayment p : payments.getOrDefault(s.getShipmentId(), List.of())) {
                if (!paymentMatches(p, f)) {
                    continue;
                }
                BigDecimal amount = round2(nz(p.getAmountEgp()).multiply(w));
                lines.add(new MovementLine(p.getPaymentDate(), MovementType.PAYMENT, s.getShipmentId(),
                        s.getShipmentCode(), s.getShipmentName(), p.getPaymentId(), p.getCostComponent(),
                        p.getPaymentMethod(), p.getPaymentCurrency(), p.getAmountOriginal(), amount));
                paymentTotal = paymentTotal.add(amount);
            }
        }
        lines.sort(Comparator.comparing(MovementLine::date, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(MovementLine::movementType)
                .thenComparing(MovementLine::shipmentId));
        return new MovementReport(lines, round2(costTotal), round2(paymentTotal),
                round2(costTotal.subtract(paymentTotal)));
    }

    public PaymentMethodsReport paymentMethodsReport(ReportFilter filter) {
        ReportFilter f = filter == null ? ReportFilter.none() : filter;
        Map<Long, List<ShipmentItem>> items = itemsByShipment();
        Map<Long, List<ShipmentPayment>> payments = paymentsByShipment();

        Map<PaymentMethod, long[]> counts = new EnumMap<>(PaymentMethod.class);
        Map<PaymentMethod, BigDecimal> totals = new EnumMap<>(PaymentMethod.class);
        for (PaymentMethod m : PaymentMethod.values()) {
            counts.put(m, new long[1]);
            totals.put(m, BigDecimal.ZERO);
        }
        for (Shipment s : shipments(f, items, false)) {
            for (ShipmentPayment p : payments.getOrDefault(s.getShipmentId(), List.of())) {
                if (!paymentMatches(p, f)) {
                    continue;
                }
                counts.get(p.getPaymentMethod())[0]++;
                totals.merge(p.getPaymentMethod(), nz(p.getAmountEgp()), BigDecimal::add);
            }
        }

        BigDecimal grand = totals.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        long grandCount = counts.values().stream().mapToLong(c -> c[0]).sum();
        List<PaymentMethodsReport.MethodTotal> rows = new ArrayList<>();
        for (PaymentMethod m : PaymentMethod.values()) {
            BigDecimal total = round2(totals.get(m));
            BigDecimal share = grand.signum() > 0
                    ? total.multiply(HUNDRED).divide(grand, 2, RoundingMode.HALF_UP)
                    : round2(BigDecimal.ZERO);
            rows.add(new PaymentMethodsReport.MethodTotal(m, counts.get(m)[0], total, share));
        }
        return new PaymentMethodsReport(rows, grandCount, round2(grand));
    }

    // -------------------------------------------------------------------------

    /**
     * Shipments passing the filter's shipment-level criteria. The date range
     * applies to the shipment date only when {@code byDate} is set.
     */
    private List<Shipment> shipments(ReportFilter f, Map<Long, List<ShipmentItem>> items, boolean byDate) {
        return shipmentRepo.findAllByOrderByCreatedAtDesc().stream()
                .filter(s -> f.includeArchived() || s.getStatus() != ShipmentStatus.ARCHIVED)
                .filter(s -> f.shipmentId() == null || f.shipmentId().equals(s.getShipmentId()))
                .filter(s -> f.shipmentStatus() == null || f.shipmentStatus() == s.getStatus())
                .filter(s -> f.paymentState() == null
                        || f.paymentState() == PaymentState.of(s.getFinalTotalCostEgp(), s.getTotalPaidEgp()))
                .filter(s -> f.supplierId() == null
                        || items.getOrDefault(s.getShipmentId(), List.of()).stream()
                                .anyMatch(i -> f.supplierId().equals(i.getSupplierId())))
                .filter(s -> !byDate || f.inRange(shipmentDate(s)))
                .toList();
    }

    private static boolean paymentMatches(ShipmentPayment p, ReportFilter f) {
        return f.inRange(p.getPaymentDate())
                && (f.costComponent() == null || f.costComponent() == p.getCostComponent())
                && (f.paymentMethod() == null || f.paymentMethod() == p.getPaymentMethod());
    }

    static BigDecimal componentCost(Shipment s, CostComponent component) {
        if (component == null) {
            return nz(s.getFinalTotalCostEgp());
        }
        return switch (component) {
            case PURCHASE -> nz(s.getPurchaseCostEgp()).add(nz(s.getCommissionCostEgp()));
            case SHIPPING -> nz(s.getShippingCostEgp());
            case CUSTOMS_AND_TAKHREEG -> nz(s.getCustomsCostEgp()).add(nz(s.getTakhreegCostEgp()));
        };
    }

    /**
     * Supplier line total RMB / shipment purchase RMB; zero when the shipment
     * has no purchase value.
     */
    static BigDecimal supplierWeight(Long supplierId, List<ShipmentItem> items) {
        if (items == null || items.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal mine = BigDecimal.ZERO;
        for (ShipmentItem i : items) {
            total = total.add(nz(i.getLineTotalRmb()));
            if (supplierId.equals(i.getSupplierId())) {
                mine = mine.add(nz(i.getLineTotalRmb()));
            }
        }
        if (total.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return mine.divide(total, WEIGHT_SCALE, RoundingMode.HALF_UP);
    }

    private static LocalDate shipmentDate(Shipment s) {
        if (s.getPurchaseDate() != null) {
            return s.getPurchaseDate();
        }
        return s.getCreatedAt() == null ? null : s.getCreatedAt().toLocalDate();
    }

    private Map<Long, List<ShipmentItem>> itemsByShipment() {
        return itemRepo.findAll().stream().collect(Collectors.groupingBy(ShipmentItem::getShipmentId));
    }

    private Map<Long, List<ShipmentPayment>> paymentsByShipment() {
        return paymentRepo.findAll().stream().collect(Collectors.groupingBy(ShipmentPayment::getShipmentId));
    }
}
