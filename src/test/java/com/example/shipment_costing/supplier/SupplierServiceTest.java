package com.example.shipment_costing.supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.shipment_costing.audit.AuditEvent;
import com.example.shipment_costing.audit.AuditSink;
import com.example.shipment_costing.entity.Supplier;
import com.example.shipment_costing.exception.NotFoundException;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.repo.ShipmentItemRepository;
import com.example.shipment_costing.repo.SupplierRepository;

class SupplierServiceTest {

    private SupplierRepository supplierRepo;
    private ShipmentItemRepository itemRepo;
    private AuditSink audit;
    private SupplierService service;

    @BeforeEach
    void setUp() {
        supplierRepo = mock(SupplierRepository.class);
        itemRepo = mock(ShipmentItemRepository.class);
        audit = mock(AuditSink.class);
        service = new SupplierService(supplierRepo, itemRepo, audit);
        when(supplierRepo.save(any(Supplier.class))).thenAnswer(inv -> {
            Supplier s = inv.getArgument(0);
            if (s.getSupplierId() == null) {
                s.setSupplierId(3L);
            }
            return s;
        });
    }

    @Test
    void createTrimsAndAudits() {
        SupplierRequest req = new SupplierRequest();
        req.setName("  Yiwu Trading ");
        req.setCountry("China");
        req.setPhone(" ");

        Supplier s = service.create(req, "accountant");

        assertEquals("Yiwu Trading", s.getName());
        assertEquals("China", s.getCountry());
        assertNull(s.getPhone());
        verify(audit).record(any(AuditEvent.class));
    }

    @Test
    void createRequiresName() {
        assertThrows(ValidationException.class, () -> service.create(new SupplierRequest(), "accountant"));
    }

    @Test
    void updateKeepsUnsetFields() {
        Supplier existing = new Supplier();
        existing.setSupplierId(3L);
        existing.setName("Yiwu Trading");
        existing.setCountry("China");
        when(supplierRepo.findById(3L)).thenReturn(Optional.of(existing));

        SupplierRequest req = new SupplierRequest();
        req.setPhone("+86 579 0000");
        Supplier s = service.update(3L, req, "accountant");

        assertEquals("Yiwu Trading", s.getName());
        assertEquals("China", s.getCountry());
        assertEquals("+86 579 0000", s.getPhone());
    }

    @Test
    void deleteReferencedSupplierIsConflict() {
        Supplier existing = new Supplier();
        existing.setSupplierId(3L);
        existing.setName("Yiwu Trading");
        when(supplierRepo.findById(3L)).thenReturn(Optional.of(existing));
        when(itemRepo.existsBySupplierId(3L)).thenReturn(true);

        assertThrows(IllegalStateException.class, () -> service.delete(3L, "admin"));
        verify(supplierRepo, never()).delete(any());
    }

    @Test
    void unknownSupplierIsNotFound() {
        when(supplierRepo.findById(9L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.get(9L));
    }
}
