package com.example.shipment_costing.supplier;

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

import com.example.shipment_costing.entity.Supplier;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/suppliers")
@RequiredArgsConstructor
public class SupplierController {

    private final SupplierService supplierService;

    @GetMapping
    public ResponseEntity<List<Supplier>> list() {
        return ResponseEntity.ok(supplierService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Supplier> get(@PathVariable Long id) {
        return ResponseEntity.ok(supplierService.get(id));
    }

    @PostMapping
    public ResponseEntity<Supplier> create(@Valid @RequestBody SupplierRequest req, Principal principal) {
        return ResponseEntity.status(HttpStatus.CREATED).body(supplierService.create(req, principal.getName()));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Supplier> update(@PathVariable Long id, @RequestBody SupplierRequest req,
            Principal principal) {
        return ResponseEntity.ok(supplierService.update(id, req, principal.getName()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Principal principal) {
        supplierService.delete(id, principal.getName());
        return ResponseEntity.noContent().build();
    }
}
