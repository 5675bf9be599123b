package com.example.shipment_costing.shipment;

import static com.example.shipment_costing.costing.Money.nz;
import static com.example.shipment_costing.costing.Money.round2;
import static com.example.shipment_costing.costing.Money.round4;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
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
import com.example.shipment_costing.costing.CostBreakdown;
import com.example.shipment_costing.costing.ShipmentCostAggregator;
import com.example.shipment_costing.entity.Shipment;
import com.example.shipment_costing.entity.ShipmentItem;
import com.example.shipment_costing.entity.ShipmentStatus;
import com.example.shipment_costing.entity.ShippingDetails;
import com.example.shipment_costing.exception.ConcurrencyTimeoutException;
import com.example.shipment_costing.exception.NotFoundException;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.fx.ExchangeRateService;
import com.example.shipment_costing.fx.RateSnapshot;
import com.example.shipment_costing.inventory.InventoryService;
import com.example.shipment_costing.repo.InventoryMovementRepository;
import com.example.shipment_costing.repo.ShipmentItemRepository;
import com.example.shipment_costing.repo.ShipmentPaymentRepository;
import com.example.shipment_costing.repo.ShipmentRepository;
import com.example.shipment_costing.repo.ShippingDetailsRepository;

@Service
public class ShipmentService {

    private static final Logger log = LoggerFactory.getLogger(ShipmentService.class);
    private static final String ENTITY = "SHIPMENT";

    private final ShipmentRepository shipmentRepo;
    private final ShipmentItemRepository itemRepo;
    private final ShippingDetailsRepository shippingRepo;
    private final ShipmentPaymentRepository paymentRepo;
    private final InventoryMovementRepository movementRepo;
    private final ShipmentCostAggregator aggregator;
    private final ShipmentStatusMachine statusMachine;
    private final ExchangeRateService rateService;
    private final InventoryService inventoryService;
    private final AuditSink audit;

    public ShipmentService(
            ShipmentRepository shipmentRepo,
            ShipmentItemRepository itemRepo,
            ShippingDetailsRepository shippingRepo,
            ShipmentPaymentRepository paymentRepo,
            InventoryMovementRepository movementRepo,
            ShipmentCostAggregator aggregator,
            ShipmentStatusMachine statusMachine,
            ExchangeRateService rateService,
            InventoryService inventoryService,
            AuditSink audit
    ) {
        this.shipmentRepo = shipmentRepo;
        this.itemRepo = itemRepo;
        this.shippingRepo = shippingRepo;
        this.paymentRepo = paymentRepo;
        this.movementRepo = movementRepo;
        this.aggregator = aggregator;
        this.statusMachine = statusMachine;
        this.rateService = rateService;
        this.inventoryService = inventoryService;
        this.audit = audit;
    }

    @Transactional
    public Shipment create(ShipmentRequest req, String userId) {
        if (req == null) {
            throw new ValidationException("shipment is required");
        }
        String code = trimToNull(req.getShipmentCode());
        String name = trimToNull(req.getShipmentName());
        if (code == null) {
            throw new ValidationException("shipmentCode is required");
        }
        if (name == null) {
            throw new ValidationException("shipmentName is required");
        }
        if (shipmentRepo.existsByShipmentCode(code)) {
            throw new ValidationException("shipmentCode already exists: " + code);
        }

        Shipment s = new Shipment();
        s.setShipmentCode(code);
        s.setShipmentName(name);
        s.setPurchaseDate(req.getPurchaseDate());
        s.setStatus(ShipmentStatus.NEW);
        s.setCreatedByUserId(userId);
        s = shipmentRepo.save(s);

        if (req.getItems() != null) {
            upsertItems(s, req.getItems());
        }
        recompute(s);
        Shipment saved = shipmentRepo.save(s);

        log.info("Shipment created id={} code={} finalTotalEgp={}",
                saved.getShipmentId(), saved.getShipmentCode(), saved.getFinalTotalCostEgp());
        Map<String, Object> details = new HashMap<>();
        details.put("shipmentCode", saved.getShipmentCode());
        details.put("finalTotalCostEgp", saved.getFinalTotalCostEgp().toPlainString());
        audit.record(AuditEvent.of(userId, ENTITY, saved.getShipmentId(), AuditAction.CREATE, details));
        return saved;
    }

    /**
     * Applies one wizard step under the shipment row lock, then recomputes
     * every cost component and the balance.
     */
    @Transactional
    public Shipment update(Long id, ShipmentRequest req, String userId) {
        if (req == null) {
            throw new ValidationException("shipment is required");
        }
        Shipment s = lockShipment(id);
        if (s.getStatus() == ShipmentStatus.ARCHIVED) {
            throw new IllegalStateException("Shipment " + id + " is archived; un-archive it before editing");
        }
        ShipmentStatus before = s.getStatus();
        int step = req.getStep() == null ? 1 : req.getStep();

        switch (step) {
            case 1 -> applyHeaderAndItems(s, req);
            case 2 -> applyShipping(s, req.getShipping());
            case 3 -> applyCustoms(s, req.getCustoms());
            case 4 -> statusMachine.validate(s.getStatus(), ShipmentStatus.RECEIVED);
            default -> throw new ValidationException("step must be between 1 and 4");
        }

        if (step == 2 && (s.getStatus() == ShipmentStatus.NEW || s.getStatus() == ShipmentStatus.AWAITING_SHIPPING)) {
            statusMachine.validate(s.getStatus(), ShipmentStatus.READY_FOR_RECEIPT);
            s.setStatus(ShipmentStatus.READY_FOR_RECEIPT);
        }

        recompute(s);

        if (step == 4) {
            s.setStatus(ShipmentStatus.RECEIVED);
        }
        Shipment saved = shipmentRepo.save(s);

        if (saved.getStatus() == ShipmentStatus.RECEIVED && before != ShipmentStatus.RECEIVED) {
            inventoryService.receive(saved, itemRepo.findByShipmentIdOrderByItemIdAsc(saved.getShipmentId()));
        }

        log.info("Shipment updated id={} step={} status={} finalTotalEgp={} balance={}",
                id, step, saved.getStatus(), saved.getFinalTotalCostEgp(), saved.getBalanceEgp());
        Map<String, Object> details = new HashMap<>();
        details.put("step", step);
        details.put("finalTotalCostEgp", saved.getFinalTotalCostEgp().toPlainString());
        details.put("balanceEgp", saved.getBalanceEgp().toPlainString());
        audit.record(AuditEvent.of(userId, ENTITY, id, AuditAction.UPDATE, details));
        if (before != saved.getStatus()) {
            auditStatusChange(userId, id, before, saved.getStatus());
        }
        return saved;
    }

    @Transactional
    public Shipment changeStatus(Long id, ShipmentStatus to, String userId) {
        Shipment s = lockShipment(id);
        ShipmentStatus from = s.getStatus();
        statusMachine.validate(from, to);
        if (from == to) {
            return s;
        }
        s.setStatus(to);
        Shipment saved = shipmentRepo.save(s);
        if (to == ShipmentStatus.RECEIVED) {
            inventoryService.receive(saved, itemRepo.findByShipmentIdOrderByItemIdAsc(id));
        }
        log.info("Shipment status id={} {} -> {}", id, from, to);
        auditStatusChange(userId, id, from, to);
        return saved;
    }

    @Transactional
    public void delete(Long id, String userId) {
        Shipment s = lockShipment(id);
        if (paymentRepo.existsByShipmentId(id)) {
            throw new IllegalStateException("Shipment " + id + " has payments and cannot be deleted");
        }
        if (movementRepo.existsByShipmentId(id)) {
            throw new IllegalStateException("Shipment " + id + " has inventory movements and cannot be deleted");
        }
        itemRepo.deleteByShipmentId(id);
        shippingRepo.deleteByShipmentId(id);
        shipmentRepo.delete(s);

        log.info("Shipment deleted id={} code={}", id, s.getShipmentCode());
        audit.record(AuditEvent.of(userId, ENTITY, id, AuditAction.DELETE,
                Map.of("shipmentCode", s.getShipmentCode())));
    }

    @Transactional(readOnly = true)
    public List<Shipment> list() {
        return shipmentRepo.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public Shipment get(Long id) {
        return shipmentRepo.findById(id)
                .orElseThrow(() -> new NotFoundException("Shipment", id));
    }

    @Transactional(readOnly = true)
    public List<ShipmentItem> items(Long id) {
        get(id);
        return itemRepo.findByShipmentIdOrderByItemIdAsc(id);
    }

    @Transactional(readOnly = true)
    public Optional<ShippingDetails> shippingDetails(Long id) {
        get(id);
        return shippingRepo.findByShipmentId(id);
    }

    // -------------------------------------------------------------------------

    private void applyHeaderAndItems(Shipment s, ShipmentRequest req) {
        String code = trimToNull(req.getShipmentCode());
        if (code != null && !code.equals(s.getShipmentCode())) {
            if (shipmentRepo.existsByShipmentCode(code)) {
                throw new ValidationException("shipmentCode already exists: " + code);
            }
            s.setShipmentCode(code);
        }
        String name = trimToNull(req.getShipmentName());
        if (name != null) {
            s.setShipmentName(name);
        }
        if (req.getPurchaseDate() != null) {
            s.setPurchaseDate(req.getPurchaseDate());
        }
        if (req.getItems() != null) {
            upsertItems(s, req.getItems());
        }
    }

    /**
     * Items with an id are updated, items without one are inserted, existing
     * items missing from the request are deleted.
     */
    private void upsertItems(Shipment s, List<ItemRequest> requested) {
        Long shipmentId = s.getShipmentId();
        Map<Long, ShipmentItem> existing = itemRepo.findByShipmentIdOrderByItemIdAsc(shipmentId).stream()
                .collect(Collectors.toMap(ShipmentItem::getItemId, Function.identity()));

        List<ShipmentItem> toSave = new ArrayList<>();
        for (ItemRequest r : requested) {
            ShipmentItem item;
            if (r.getItemId() != null) {
                item = existing.remove(r.getItemId());
                if (item == null) {
                    throw new ValidationException(
                            "item " + r.getItemId() + " does not belong to shipment " + shipmentId);
                }
            } else {
                if (s.getStatus() == ShipmentStatus.RECEIVED) {
                    throw new IllegalStateException("Items cannot be added to a received shipment");
                }
                item = new ShipmentItem();
                item.setShipmentId(shipmentId);
            }
            applyItem(item, r);
            toSave.add(item);
        }

        if (!existing.isEmpty()) {
            if (s.getStatus() == ShipmentStatus.RECEIVED) {
                throw new IllegalStateException("Items of a received shipment cannot be removed");
            }
            itemRepo.deleteAll(existing.values());
        }
        itemRepo.saveAll(toSave);
    }

    private void applyItem(ShipmentItem item, ItemRequest r) {
        String productName = trimToNull(r.getProductName());
        if (productName == null) {
            throw new ValidationException("productName is required");
        }
        if (r.getCartons() < 0 || r.getPiecesPerCarton() < 0) {
            throw new ValidationException("cartons and piecesPerCarton must not be negative");
        }
        requireNonNegative(r.getUnitPriceRmb(), "unitPriceRmb");
        requireNonNegative(r.getCustomsCostPerCartonEgp(), "customsCostPerCartonEgp");
        requireNonNegative(r.getTakhreegCostPerCartonEgp(), "takhreegCostPerCartonEgp");

        item.setSupplierId(r.getSupplierId());
        item.setProductName(productName);
        item.setProductType(trimToNull(r.getProductType()));
        item.setCountryOfOrigin(trimToNull(r.getCountryOfOrigin()));
        item.setImageUrl(trimToNull(r.getImageUrl()));
        item.setCartons(r.getCartons());
        item.setPiecesPerCarton(r.getPiecesPerCarton());
        item.setUnitPriceRmb(round4(r.getUnitPriceRmb()));
        if (r.getCustomsCostPerCartonEgp() != null) {
            item.setCustomsCostPerCartonEgp(round2(r.getCustomsCostPerCartonEgp()));
        }
        if (r.getTakhreegCostPerCartonEgp() != null) {
            item.setTakhreegCostPerCartonEgp(round2(r.getTakhreegCostPerCartonEgp()));
        }
        aggregator.deriveLineTotals(item);
    }

    private void applyShipping(Shipment s, ShippingRequest r) {
        if (r == null) {
            throw new ValidationException("shipping is required for step 2");
        }
        requireNonNegative(r.getCommissionRatePercent(), "commissionRatePercent");
        requireNonNegative(r.getShippingAreaSqm(), "shippingAreaSqm");
        requireNonNegative(r.getShippingCostPerSqmUsd(), "shippingCostPerSqmUsd");
        requireNonNegative(r.getUsdToRmbRateAtShipping(), "usdToRmbRateAtShipping");
        requireNonNegative(r.getRmbToEgpRateAtShipping(), "rmbToEgpRateAtShipping");

        ShippingDetails d = shippingRepo.findByShipmentId(s.getShipmentId()).orElseGet(() -> {
            ShippingDetails fresh = new ShippingDetails();
            fresh.setShipmentId(s.getShipmentId());
            return fresh;
        });

        RateSnapshot latest = null;
        if (r.getRmbToEgpRateAtShipping() == null || r.getUsdToRmbRateAtShipping() == null) {
            latest = rateService.currentSnapshot();
        }
        BigDecimal rmbToEgp = r.getRmbToEgpRateAtShipping() != null ? r.getRmbToEgpRateAtShipping()
                : d.getRmbToEgpRateAtShipping() != null ? d.getRmbToEgpRateAtShipping() : latest.rmbToEgp();
        BigDecimal usdToRmb = r.getUsdToRmbRateAtShipping() != null ? r.getUsdToRmbRateAtShipping()
                : d.getUsdToRmbRateAtShipping() != null ? d.getUsdToRmbRateAtShipping() : latest.usdToRmb();

        d.setCommissionRatePercent(round4(r.getCommissionRatePercent()));
        d.setShippingAreaSqm(round2(r.getShippingAreaSqm()));
        d.setShippingCostPerSqmUsd(round2(r.getShippingCostPerSqmUsd()));
        d.setRmbToEgpRateAtShipping(rmbToEgp == null ? null : round4(rmbToEgp));
        d.setUsdToRmbRateAtShipping(usdToRmb == null ? null : round4(usdToRmb));
        if (r.getShippingDate() != null) {
            d.setShippingDate(r.getShippingDate());
        }
        shippingRepo.save(d);
    }

    private void applyCustoms(Shipment s, List<CustomsRequest> customs) {
        if (customs == null) {
            throw new ValidationException("customs is required for step 3");
        }
        Map<Long, ShipmentItem> items = itemRepo.findByShipmentIdOrderByItemIdAsc(s.getShipmentId()).stream()
                .collect(Collectors.toMap(ShipmentItem::getItemId, Function.identity()));
        for (CustomsRequest c : customs) {
            ShipmentItem item = items.get(c.getItemId());
            if (item == null) {
                throw new ValidationException(
                        "item " + c.getItemId() + " does not belong to shipment " + s.getShipmentId());
            }
            requireNonNegative(c.getCustomsCostPerCartonEgp(), "customsCostPerCartonEgp");
            requireNonNegative(c.getTakhreegCostPerCartonEgp(), "takhreegCostPerCartonEgp");
            item.setCustomsCostPerCartonEgp(round2(c.getCustomsCostPerCartonEgp()));
            item.setTakhreegCostPerCartonEgp(round2(c.getTakhreegCostPerCartonEgp()));
        }
        itemRepo.saveAll(items.values());
    }

    /**
     * Full recompute from the current items, shipping details and payment
     * history.
     */
    private void recompute(Shipment s) {
        List<ShipmentItem> items = itemRepo.findByShipmentIdOrderByItemIdAsc(s.getShipmentId());
        ShippingDetails shipping = shippingRepo.findByShipmentId(s.getShipmentId()).orElse(null);
        RateSnapshot latest = shipping == null ? rateService.currentSnapshot() : null;

        s.setTotalPaidEgp(round2(nz(paymentRepo.sumAndLatestDate(s.getShipmentId()).getTotalPaid())));
        CostBreakdown breakdown = aggregator.aggregate(items, shipping, latest);
        breakdown.applyTo(s);
    }

    private Shipment lockShipment(Long id) {
        try {
            return shipmentRepo.findByIdForUpdate(id)
                    .orElseThrow(() -> new NotFoundException("Shipment", id));
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock wait timed out for shipment={}", id);
            throw new ConcurrencyTimeoutException("Shipment " + id + " is busy, retry the update", e);
        }
    }

    private void auditStatusChange(String userId, Long id, ShipmentStatus from, ShipmentStatus to) {
        Map<String, Object> details = new HashMap<>();
        details.put("from", from == null ? null : from.name());
        details.put("to", to.name());
        audit.record(AuditEvent.of(userId, ENTITY, id, AuditAction.STATUS_CHANGE, details));
    }

    private static void requireNonNegative(BigDecimal v, String field) {
        if (v != null && v.signum() < 0) {
            throw new ValidationException(field + " must not be negative");
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
