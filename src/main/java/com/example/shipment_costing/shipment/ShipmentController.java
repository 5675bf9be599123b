package com.example.shipment_costing.shipment;

import java.security.Principal;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.shipment_costing.entity.Shipment;
import com.example.shipment_costing.entity.ShipmentItem;
import com.example.shipment_costing.entity.ShippingDetails;
import com.example.shipment_costing.exception.NotFoundException;
import com.example.shipment_costing.payment.PaymentSettlementService;
import com.example.shipment_costing.payment.PaymentView;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/shipments")
@RequiredArgsConstructor
public class ShipmentController {

    private final ShipmentService shipmentService;
    private final PaymentSettlementService settlementService;

    @GetMapping
    public ResponseEntity<List<Shipment>> list() {
        return ResponseEntity.ok(shipmentService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Shipment> get(@PathVariable Long id) {
        return ResponseEntity.ok(shipmentService.get(id));
    }

    @PostMapping
    public ResponseEntity<Shipment> create(@Valid @RequestBody ShipmentRequest req, Principal principal) {
        return ResponseEntity.status(HttpStatus.CREATED).body(shipmentService.create(req, principal.getName()));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Shipment> update(@PathVariable Long id, @Valid @RequestBody ShipmentRequest req,
            Principal principal) {
        return ResponseEntity.ok(shipmentService.update(id, req, principal.getName()));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<Shipment> changeStatus(@PathVariable Long id, @Valid @RequestBody StatusChangeRequest req,
            Principal principal) {
        return ResponseEntity.ok(shipmentService.changeStatus(id, req.getStatus(), principal.getName()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Principal principal) {
        shipmentService.delete(id, principal.getName());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/items")
    public ResponseEntity<List<ShipmentItem>> items(@PathVariable Long id) {
        return ResponseEntity.ok(shipmentService.items(id));
    }

    @GetMapping("/{id}/shipping")
    public ResponseEntity<ShippingDetails> shipping(@PathVariable Long id) {
        return ResponseEntity.ok(shipmentService.shippingDetails(id)
                .orElseThrow(() -> new NotFoundException("ShippingDetails", id)));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<List<PaymentView>> payments(@PathVariable Long id) {
        return ResponseEntity.ok(settlementService.listForShipment(id));
    }
}
