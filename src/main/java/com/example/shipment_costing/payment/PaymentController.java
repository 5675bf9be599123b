package com.example.shipment_costing.payment;

import java.security.Principal;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * Payments are append-only: there is no update or delete endpoint.
 */
@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentSettlementService settlementService;

    @GetMapping
    public ResponseEntity<List<PaymentView>> list() {
        return ResponseEntity.ok(settlementService.list());
    }

    @GetMapping("/stats")
    public ResponseEntity<PaymentStats> stats() {
        return ResponseEntity.ok(settlementService.stats());
    }

    @PostMapping
    public ResponseEntity<SettlementResult> create(@Valid @RequestBody PaymentRequest req, Principal principal) {
        SettlementResult result = settlementService.recordPayment(req.getShipmentId(), req, principal.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }
}
