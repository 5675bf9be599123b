package com.example.shipment_costing.inventory;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;

    @GetMapping
    public ResponseEntity<List<InventoryView>> list() {
        return ResponseEntity.ok(inventoryService.list());
    }

    @GetMapping("/stats")
    public ResponseEntity<InventoryStats> stats() {
        return ResponseEntity.ok(inventoryService.stats());
    }
}
