package com.example.shipment_costing.inventory;

import static com.example.shipment_costing.costing.Money.nz;
import static com.example.shipment_costing.costing.Money.round2;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.shipment_costing.entity.InventoryMovement;
import com.example.shipment_costing.entity.Shipment;
import com.example.shipment_costing.entity.ShipmentItem;
import com.example.shipment_costing.repo.InventoryMovementRepository;
import com.example.shipment_costing.repo.ShipmentItemRepository;
import com.example.shipment_costing.repo.ShipmentRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class InventoryService {

    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

    private final InventoryMovementRepository movementRepo;
    private final ShipmentRepository shipmentRepo;
    private final ShipmentItemRepository itemRepo;

    /**
     * One inbound movement per item, priced at landed cost. Does nothing if the
     * shipment already has movements.
     *
     * Landed cost of an item = its share of purchase, commission and shipping
     * EGP (weighted by line total RMB, or by pieces when the shipment has no
     * purchase value) plus its own customs and takhreeg.
     */
    @Transactional
    public List<InventoryMovement> receive(Shipment shipment, List<ShipmentItem> items) {
        if (movementRepo.existsByShipmentId(shipment.getShipmentId())) {
            log.info("Inventory already received for shipment={}", shipment.getShipmentId());
            return List.of();
        }

        BigDecimal purchaseRmb = BigDecimal.ZERO;
        long pieces = 0;
        for (ShipmentItem item : items) {
            purchaseRmb = purchaseRmb.add(nz(item.getLineTotalRmb()));
            pieces += item.getTotalPieces();
        }
        BigDecimal shared = nz(shipment.getPurchaseCostEgp())
                .add(nz(shipment.getCommissionCostEgp()))
                .add(nz(shipment.getShippingCostEgp()));

        LocalDate today = LocalDate.now();
        List<InventoryMovement> out = new ArrayList<>();
        for (ShipmentItem item : items) {
            BigDecimal weight;
            if (purchaseRmb.signum() > 0) {
                weight = nz(item.getLineTotalRmb()).divide(purchaseRmb, 10, RoundingMode.HALF_UP);
            } else if (pieces > 0) {
                weight = BigDecimal.valueOf(item.getTotalPieces()).divide(BigDecimal.valueOf(pieces), 10,
                        RoundingMode.HALF_UP);
            } else {
                weight = BigDecimal.ZERO;
            }
            BigDecimal cartons = BigDecimal.valueOf(item.getCartons());
            BigDecimal landed = shared.multiply(weight)
                    .add(cartons.multiply(nz(item.getCustomsCostPerCartonEgp())))
                    .add(cartons.multiply(nz(item.getTakhreegCostPerCartonEgp())));

            InventoryMovement m = new InventoryMovement();
            m.setShipmentId(shipment.getShipmentId());
            m.setShipmentItemId(item.getItemId());
            m.setTotalPiecesIn(item.getTotalPieces());
            m.setUnitCostRmb(item.getUnitPriceRmb());
            m.setTotalCostEgp(round2(landed));
            m.setUnitCostEgp(item.getTotalPieces() > 0
                    ? landed.divide(BigDecimal.valueOf(item.getTotalPieces()), 4, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO.setScale(4));
            m.setMovementDate(today);
            out.add(movementRepo.save(m));
        }
        log.info("Inventory received shipment={} movements={} pieces={}",
                shipment.getShipmentId(), out.size(), pieces);
        return out;
    }

    @Transactional(readOnly = true)
    public List<InventoryView> list() {
        Map<Long, Shipment> shipments = shipmentRepo.findAll().stream()
                .collect(Collectors.toMap(Shipment::getShipmentId, Function.identity()));
        Map<Long, ShipmentItem> items = itemRepo.findAll().stream()
                .collect(Collectors.toMap(ShipmentItem::getItemId, Function.identity()));
        return movementRepo.findAllByOrderByMovementDateDescMovementIdDesc().stream()
                .map(m -> InventoryView.of(m, shipments.get(m.getShipmentId()), items.get(m.getShipmentItemId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public InventoryStats stats() {
        long totalPieces = 0;
        BigDecimal totalCost = BigDecimal.ZERO;
        List<InventoryMovement> all = movementRepo.findAll();
        for (InventoryMovement m : all) {
            totalPieces += m.getTotalPiecesIn();
            totalCost = totalCost.add(nz(m.getTotalCostEgp()));
        }
        BigDecimal avg = totalPieces > 0
                ? totalCost.divide(BigDecimal.valueOf(totalPieces), 4, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(4);
        return new InventoryStats(totalPieces, round2(totalCost), all.size(), avg);
    }
}
