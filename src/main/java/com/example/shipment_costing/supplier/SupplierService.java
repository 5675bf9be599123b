package com.example.shipment_costing.supplier;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.shipment_costing.audit.AuditAction;
import com.example.shipment_costing.audit.AuditEvent;
import com.example.shipment_costing.audit.AuditSink;
import com.example.shipment_costing.entity.Supplier;
import com.example.shipment_costing.exception.NotFoundException;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.repo.ShipmentItemRepository;
import com.example.shipment_costing.repo.SupplierRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class SupplierService {

    private static final Logger log = LoggerFactory.getLogger(SupplierService.class);
    private static final String ENTITY = "SUPPLIER";

    private final SupplierRepository supplierRepo;
    private final ShipmentItemRepository itemRepo;
    private final AuditSink audit;

    @Transactional(readOnly = true)
    public List<Supplier> list() {
        return supplierRepo.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Supplier get(Long id) {
        return supplierRepo.findById(id).orElseThrow(() -> new NotFoundException("Supplier", id));
    }

    @Transactional
    public Supplier create(SupplierRequest req, String userId) {
        Supplier s = new Supplier();
        apply(s, req);
        Supplier saved = supplierRepo.save(s);
        log.info("Supplier created id={} name={}", saved.getSupplierId(), saved.getName());
        audit.record(AuditEvent.of(userId, ENTITY, saved.getSupplierId(), AuditAction.CREATE,
                Map.of("name", saved.getName())));
        return saved;
    }

    /**
     * Partial update: null fields keep their current value.
     */
    @Transactional
    public Supplier update(Long id, SupplierRequest req, String userId) {
        Supplier s = get(id);
        if (req.getName() != null) {
            String name = req.getName().trim();
            if (name.isEmpty()) {
                throw new ValidationException("name must not be blank");
            }
            s.setName(name);
        }
        if (req.getCountry() != null) {
            s.setCountry(blankToNull(req.getCountry()));
        }
        if (req.getPhone() != null) {
            s.setPhone(blankToNull(req.getPhone()));
        }
        Supplier saved = supplierRepo.save(s);

        Map<String, Object> details = new HashMap<>();
        details.put("name", saved.getName());
        details.put("country", saved.getCountry());
        audit.record(AuditEvent.of(userId, ENTITY, id, AuditAction.UPDATE, details));
        return saved;
    }

    /**
     * Suppliers referenced by shipment items stay, so supplier reports keep
     * their history.
     */
    @Transactional
    public void delete(Long id, String userId) {
        Supplier s = get(id);
        if (itemRepo.existsBySupplierId(id)) {
            throw new IllegalStateException("Supplier " + id + " is referenced by shipment items");
        }
        supplierRepo.delete(s);
        log.info("Supplier deleted id={} name={}", id, s.getName());
        audit.record(AuditEvent.of(userId, ENTITY, id, AuditAction.DELETE, Map.of("name", s.getName())));
    }

    private static void apply(Supplier s, SupplierRequest req) {
        if (req == null || req.getName() == null || req.getName().isBlank()) {
            throw new ValidationException("name is required");
        }
        s.setName(req.getName().trim());
        s.setCountry(blankToNull(req.getCountry()));
        s.setPhone(blankToNull(req.getPhone()));
    }

    private static String blankToNull(String v) {
        return v == null || v.isBlank() ? null : v.trim();
    }
}
