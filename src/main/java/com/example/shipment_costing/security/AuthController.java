package com.example.shipment_costing.security;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.shipment_costing.audit.AuditAction;
import com.example.shipment_costing.audit.AuditEvent;
import com.example.shipment_costing.audit.AuditSink;
import com.example.shipment_costing.entity.AppUser;
import com.example.shipment_costing.repo.AppUserRepository;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final JwtTokenService jwtTokenService;
    private final AppUserRepository userRepo;
    private final PasswordEncoder passwordEncoder;
    private final AuditSink audit;

    /**
     * Username/password login. Returns a JWT carrying the user's role.
     */
    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody LoginRequest request) {
        if (request == null || request.username == null || request.password == null) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "username and password are required"));
        }

        String username = request.username.trim().toLowerCase();
        if (username.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "username is required"));
        }

        AppUser user = userRepo.findByUsername(username).orElse(null);
        if (user == null || !passwordEncoder.matches(request.password, user.getPasswordHash())) {
            log.warn("Failed login for '{}'", username);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "invalid credentials"));
        }

        String token = jwtTokenService.generateToken(user.getUsername(), user.getRole());
        return ResponseEntity.ok(Map.of(
                "token", token,
                "username", user.getUsername(),
                "role", user.getRole().name()));
    }

    @GetMapping("/user")
    public ResponseEntity<?> currentUser(Authentication authentication) {
        AppUser user = userRepo.findByUsername(authentication.getName()).orElse(null);
        if (user == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "user no longer exists"));
        }
        Map<String, Object> body = new HashMap<>();
        body.put("userId", user.getUserId());
        body.put("username", user.getUsername());
        body.put("role", user.getRole().name());
        body.put("displayName", user.getDisplayName());
        return ResponseEntity.ok(body);
    }

    /**
     * Changes the caller's own password. The current password is always required.
     */
    @PostMapping("/change-password")
    @Transactional
    public ResponseEntity<?> changePassword(Authentication authentication,
            @RequestBody ChangePasswordRequest request) {
        if (request == null || request.currentPassword == null || request.newPassword == null) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "currentPassword and newPassword are required"));
        }

        if (request.newPassword.length() < 8) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "newPassword must be at least 8 characters"));
        }

        AppUser user = userRepo.findByUsername(authentication.getName()).orElse(null);
        if (user == null || !passwordEncoder.matches(request.currentPassword, user.getPasswordHash())) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "current password is incorrect"));
        }

        user.setPasswordHash(passwordEncoder.encode(request.newPassword));
        userRepo.save(user);
        audit.record(AuditEvent.of(user.getUsername(), "USER", user.getUserId(), AuditAction.UPDATE,
                Map.of("field", "password")));

        return ResponseEntity.ok(Map.of(
                "message", "password changed successfully",
                "username", user.getUsername()));
    }

    public static class LoginRequest {
        public String username;
        public String password;
    }

    public static class ChangePasswordRequest {
        public String currentPassword;
        public String newPassword;
    }
}
