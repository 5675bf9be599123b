package com.example.shipment_costing.payment;

import static com.example.shipment_costing.costing.Money.EPSILON;
import static com.example.shipment_costing.costing.Money.nz;
import static com.example.shipment_costing.costing.Money.round2;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.shipment_costing.audit.AuditAction;
import com.example.shipment_costing.audit.AuditEvent;
import com.example.shipment_costing.audit.AuditSink;
import com.example.shipment_costing.costing.Money;
import com.example.shipment_costing.entity.Shipment;
import com.example.shipment_costing.entity.ShipmentPayment;
import com.example.shipment_costing.exception.ConcurrencyTimeoutException;
import com.example.shipment_costing.exception.NotFoundException;
import com.example.shipment_costing.exception.OverpaymentException;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.fx.CurrencyNormalizer;
import com.example.shipment_costing.fx.NormalizedAmount;
import com.example.shipment_costing.repo.ShipmentPaymentRepository;
import com.example.shipment_costing.repo.ShipmentPaymentRepository.PaymentSummary;
import com.example.shipment_costing.repo.ShipmentRepository;

/**
 * Applies payments to shipments. Each call holds the shipment row lock for
 * the whole read-check-write sequence, so concurrent payments against one
 * shipment are serialized and cannot overdraw it.
 */
@Service
public class PaymentSettlementService {

    private static final Logger log = LoggerFactory.getLogger(PaymentSettlementService.class);

    private final ShipmentRepository shipmentRepo;
    private final ShipmentPaymentRepository paymentRepo;
    private final CurrencyNormalizer normalizer;
    private final AuditSink audit;

    public PaymentSettlementService(
            ShipmentRepository shipmentRepo,
            ShipmentPaymentRepository paymentRepo,
            CurrencyNormalizer normalizer,
            AuditSink audit
    ) {
        this.shipmentRepo = shipmentRepo;
        this.paymentRepo = paymentRepo;
        this.normalizer = normalizer;
        this.audit = audit;
    }

    @Transactional
    public SettlementResult recordPayment(Long shipmentId, PaymentRequest req, String userId) {
        if (shipmentId == null) {
            throw new ValidationException("shipmentId is required");
        }
        if (req == null) {
            throw new ValidationException("payment is required");
        }
        if (req.getCostComponent() == null) {
            throw new ValidationException("costComponent is required");
        }
        if (req.getPaymentMethod() == null) {
            throw new ValidationException("paymentMethod is required");
        }

        Shipment shipment = lockShipment(shipmentId);

        NormalizedAmount amount = normalizer.normalize(
                req.getPaymentCurrency(), req.getAmountOriginal(), req.getExchangeRateToEgp());

        // paid total re-read under the lock; the row's cached total may be stale
        BigDecimal paidBefore = round2(nz(paymentRepo.sumAndLatestDate(shipmentId).getTotalPaid()));
        BigDecimal remainingBefore = Money.balance(shipment.getFinalTotalCostEgp(), paidBefore);

        if (amount.amountEgp().compareTo(remainingBefore.add(EPSILON)) > 0) {
            log.warn("Overpayment rejected shipment={} amountEgp={} remaining={}",
                    shipmentId, amount.amountEgp(), remainingBefore);
            throw new OverpaymentException(remainingBefore, amount.amountEgp());
        }

        ShipmentPayment payment = new ShipmentPayment();
        payment.setShipmentId(shipmentId);
        payment.setPaymentDate(req.getPaymentDate() != null ? req.getPaymentDate() : LocalDate.now());
        payment.setPaymentCurrency(req.getPaymentCurrency());
        payment.setAmountOriginal(amount.amountOriginal());
        payment.setExchangeRateToEgp(amount.exchangeRateToEgp());
        payment.setAmountEgp(amount.amountEgp());
        payment.setCostComponent(req.getCostComponent());
        payment.setPaymentMethod(req.getPaymentMethod());
        payment.setCashReceiverName(trimToNull(req.getCashReceiverName()));
        payment.setReferenceNumber(trimToNull(req.getReferenceNumber()));
        payment.setNote(trimToNull(req.getNote()));
        payment.setCreatedByUserId(userId);
        ShipmentPayment saved = paymentRepo.saveAndFlush(payment);

        PaymentSummary summary = paymentRepo.sumAndLatestDate(shipmentId);
        BigDecimal totalPaid = round2(nz(summary.getTotalPaid()));
        shipment.setTotalPaidEgp(totalPaid);
        shipment.setBalanceEgp(Money.balance(shipment.getFinalTotalCostEgp(), totalPaid));
        shipment.setLastPaymentDate(summary.getLastDate());
        shipmentRepo.save(shipment);

        PaymentState state = PaymentState.of(shipment.getFinalTotalCostEgp(), totalPaid);
        log.info("Payment recorded id={} shipment={} amountEgp={} paid={} balance={} state={}",
                saved.getPaymentId(), shipmentId, saved.getAmountEgp(), totalPaid,
                shipment.getBalanceEgp(), state);

        Map<String, Object> details = new HashMap<>();
        details.put("shipmentId", shipmentId);
        details.put("currency", saved.getPaymentCurrency().name());
        details.put("amountOriginal", saved.getAmountOriginal().toPlainString());
        details.put("amountEgp", saved.getAmountEgp().toPlainString());
        details.put("costComponent", saved.getCostComponent().name());
        details.put("paymentMethod", saved.getPaymentMethod().name());
        details.put("balanceEgp", shipment.getBalanceEgp().toPlainString());
        audit.record(AuditEvent.of(userId, "PAYMENT", saved.getPaymentId(), AuditAction.CREATE, details));

        return new SettlementResult(saved, shipmentId, shipment.getFinalTotalCostEgp(), totalPaid,
                shipment.getBalanceEgp(), shipment.getLastPaymentDate(), state);
    }

    @Transactional(readOnly = true)
    public List<PaymentView> list() {
        Map<Long, Shipment> shipments = shipmentRepo.findAll().stream()
                .collect(Collectors.toMap(Shipment::getShipmentId, Function.identity()));
        return paymentRepo.findAllByOrderByPaymentDateDescPaymentIdDesc().stream()
                .map(p -> PaymentView.of(p, shipments.get(p.getShipmentId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PaymentView> listForShipment(Long shipmentId) {
        Shipment shipment = shipmentRepo.findById(shipmentId)
                .orElseThrow(() -> new NotFoundException("Shipment", shipmentId));
        return paymentRepo.findByShipmentIdOrderByPaymentDateDescPaymentIdDesc(shipmentId).stream()
                .map(p -> PaymentView.of(p, shipment))
                .toList();
    }

    @Transactional(readOnly = true)
    public PaymentStats stats() {
        BigDecimal cost = BigDecimal.ZERO;
        BigDecimal paid = BigDecimal.ZERO;
        BigDecimal balance = BigDecimal.ZERO;
        BigDecimal overpaid = BigDecimal.ZERO;
        LocalDate last = null;
        for (Shipment s : shipmentRepo.findAll()) {
            cost = cost.add(nz(s.getFinalTotalCostEgp()));
            paid = paid.add(nz(s.getTotalPaidEgp()));
            balance = balance.add(Money.balance(s.getFinalTotalCostEgp(), s.getTotalPaidEgp()));
            overpaid = overpaid.add(Money.overpaid(s.getFinalTotalCostEgp(), s.getTotalPaidEgp()));
            if (s.getLastPaymentDate() != null && (last == null || s.getLastPaymentDate().isAfter(last))) {
                last = s.getLastPaymentDate();
            }
        }
        return new PaymentStats(round2(cost), round2(paid), round2(balance), round2(overpaid),
                paymentRepo.count(), last);
    }

    private Shipment lockShipment(Long shipmentId) {
        try {
            return shipmentRepo.findByIdForUpdate(shipmentId)
                    .orElseThrow(() -> new NotFoundException("Shipment", shipmentId));
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock wait timed out for shipment={}", shipmentId);
            throw new ConcurrencyTimeoutException("Shipment " + shipmentId + " is busy, retry the payment", e);
        }
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
