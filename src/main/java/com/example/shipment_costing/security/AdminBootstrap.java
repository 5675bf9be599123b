package com.example.shipment_costing.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.shipment_costing.entity.AppUser;
import com.example.shipment_costing.entity.UserRole;
import com.example.shipment_costing.repo.AppUserRepository;

import lombok.RequiredArgsConstructor;

/**
 * Creates the first ADMIN account when the user table is empty.
 */
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrap.class);
    static final String DEFAULT_PASSWORD = "admin12345";

    private final AppUserRepository userRepo;
    private final PasswordEncoder passwordEncoder;

    @Value("${app.bootstrap.admin-username:admin}")
    private String adminUsername;

    @Value("${app.bootstrap.admin-password:" + DEFAULT_PASSWORD + "}")
    private String adminPassword;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (userRepo.count() > 0) {
            return;
        }
        AppUser admin = new AppUser();
        admin.setUsername(adminUsername.trim().toLowerCase());
        admin.setPasswordHash(passwordEncoder.encode(adminPassword));
        admin.setRole(UserRole.ADMIN);
        admin.setDisplayName("Administrator");
        userRepo.save(admin);

        if (DEFAULT_PASSWORD.equals(adminPassword)) {
            log.warn("Bootstrap admin '{}' created with the DEFAULT password - change it immediately",
                    admin.getUsername());
        } else {
            log.info("Bootstrap admin '{}' created", admin.getUsername());
        }
    }
}
