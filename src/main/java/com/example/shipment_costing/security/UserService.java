package com.example.shipment_costing.security;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.shipment_costing.audit.AuditAction;
import com.example.shipment_costing.audit.AuditEvent;
import com.example.shipment_costing.audit.AuditSink;
import com.example.shipment_costing.entity.AppUser;
import com.example.shipment_costing.entity.UserRole;
import com.example.shipment_costing.exception.NotFoundException;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.repo.AppUserRepository;

import lombok.RequiredArgsConstructor;

/**
 * User administration. Creating, deleting and re-roling users is gated to
 * ADMIN at the HTTP layer; {@link #update} also lets a user edit their own
 * profile, so it checks the caller itself.
 */
@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    private static final String ENTITY = "USER";
    static final int MIN_PASSWORD_LENGTH = 8;

    private final AppUserRepository userRepo;
    private final PasswordEncoder passwordEncoder;
    private final AuditSink audit;

    @Transactional(readOnly = true)
    public List<UserView> list() {
        return userRepo.findAll().stream().map(UserView::of).toList();
    }

    @Transactional
    public UserView create(UserRequest req, String actor) {
        if (req == null || req.getUsername() == null || req.getUsername().isBlank() || req.getPassword() == null) {
            throw new ValidationException("username and password are required");
        }
        String username = req.getUsername().trim().toLowerCase();
        if (userRepo.findByUsername(username).isPresent()) {
            throw new ValidationException("username already exists: " + username);
        }
        requireStrongEnough(req.getPassword());

        AppUser u = new AppUser();
        u.setUsername(username);
        u.setPasswordHash(passwordEncoder.encode(req.getPassword()));
        u.setDisplayName(req.getDisplayName());
        u.setRole(req.getRole() == null ? UserRole.VIEWER : req.getRole());
        AppUser saved = userRepo.save(u);

        log.info("User created username={} role={} by={}", saved.getUsername(), saved.getRole(), actor);
        audit.record(AuditEvent.of(actor, ENTITY, saved.getUserId(), AuditAction.CREATE,
                Map.of("role", saved.getRole().name())));
        return UserView.of(saved);
    }

    /**
     * Non-admins may only edit themselves and never their role.
     */
    @Transactional
    public UserView update(Long id, UserRequest req, String actor, boolean actorIsAdmin) {
        AppUser u = userRepo.findById(id).orElseThrow(() -> new NotFoundException("User", id));
        boolean self = u.getUsername().equals(actor);
        if (!self && !actorIsAdmin) {
            throw new AccessDeniedException("Only an admin can edit other users");
        }
        if (req.getRole() != null && !actorIsAdmin) {
            throw new AccessDeniedException("Only an admin can change roles");
        }

        List<String> changed = new ArrayList<>();
        if (req.getPassword() != null) {
            requireStrongEnough(req.getPassword());
            u.setPasswordHash(passwordEncoder.encode(req.getPassword()));
            changed.add("password");
        }
        if (req.getDisplayName() != null) {
            u.setDisplayName(req.getDisplayName());
            changed.add("displayName");
        }
        if (req.getRole() != null) {
            u.setRole(req.getRole());
            changed.add("role");
        }
        AppUser saved = userRepo.save(u);

        Map<String, Object> details = new HashMap<>();
        details.put("updatedFields", changed);
        audit.record(AuditEvent.of(actor, ENTITY, id, AuditAction.UPDATE, details));
        return UserView.of(saved);
    }

    @Transactional
    public UserView changeRole(Long id, UserRole role, String actor) {
        if (role == null) {
            throw new ValidationException("role is required");
        }
        AppUser u = userRepo.findById(id).orElseThrow(() -> new NotFoundException("User", id));
        UserRole before = u.getRole();
        u.setRole(role);
        AppUser saved = userRepo.save(u);

        log.info("User role changed username={} {} -> {} by={}", saved.getUsername(), before, role, actor);
        audit.record(AuditEvent.of(actor, ENTITY, id, AuditAction.UPDATE, Map.of("role", role.name())));
        return UserView.of(saved);
    }

    @Transactional
    public void delete(Long id, String actor) {
        AppUser u = userRepo.findById(id).orElseThrow(() -> new NotFoundException("User", id));
        if (u.getUsername().equals(actor)) {
            throw new ValidationException("You cannot delete your own account");
        }
        if (u.getRole() == UserRole.ADMIN && userRepo.countByRole(UserRole.ADMIN) <= 1) {
            throw new IllegalStateException("The last admin account cannot be deleted");
        }
        userRepo.delete(u);
        log.info("User deleted username={} by={}", u.getUsername(), actor);
        audit.record(AuditEvent.of(actor, ENTITY, id, AuditAction.DELETE, Map.of("username", u.getUsername())));
    }

    static void requireStrongEnough(String password) {
        if (password.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
    }
}
