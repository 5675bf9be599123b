package com.example.shipment_costing.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.example.shipment_costing.audit.AuditSink;
import com.example.shipment_costing.entity.AppUser;
import com.example.shipment_costing.entity.UserRole;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.repo.AppUserRepository;

class UserServiceTest {

    private AppUserRepository userRepo;
    private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private UserService service;

    @BeforeEach
    void setUp() {
        userRepo = mock(AppUserRepository.class);
        service = new UserService(userRepo, encoder, mock(AuditSink.class));
        when(userRepo.save(any(AppUser.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createDefaultsToViewerAndHashesPassword() {
        when(userRepo.findByUsername("mona")).thenReturn(Optional.empty());
        UserRequest req = request(" Mona ", "correct-horse");

        UserView user = service.create(req, "admin");

        assertEquals("mona", user.username());
        assertEquals(UserRole.VIEWER, user.role());
    }

    @Test
    void createRejectsDuplicateAndShortPassword() {
        when(userRepo.findByUsername("mona")).thenReturn(Optional.of(user(2L, "mona", UserRole.VIEWER)));
        assertThrows(ValidationException.class, () -> service.create(request("mona", "correct-horse"), "admin"));

        when(userRepo.findByUsername("omar")).thenReturn(Optional.empty());
        assertThrows(ValidationException.class, () -> service.create(request("omar", "short"), "admin"));
    }

    @Test
    void nonAdminCanEditOnlyThemselvesWithoutRole() {
        AppUser mona = user(2L, "mona", UserRole.ACCOUNTANT);
        when(userRepo.findById(2L)).thenReturn(Optional.of(mona));

        UserRequest pwd = new UserRequest();
        pwd.setPassword("a-new-password");
        service.update(2L, pwd, "mona", false);
        assertTrue(encoder.matches("a-new-password", mona.getPasswordHash()));

        UserRequest promote = new UserRequest();
        promote.setRole(UserRole.ADMIN);
        assertThrows(AccessDeniedException.class, () -> service.update(2L, promote, "mona", false));
        assertThrows(AccessDeniedException.class, () -> service.update(2L, pwd, "omar", false));
        assertEquals(UserRole.ACCOUNTANT, mona.getRole());
    }

    @Test
    void deleteProtectsSelfAndLastAdmin() {
        AppUser admin = user(1L, "admin", UserRole.ADMIN);
        AppUser other = user(3L, "root2", UserRole.ADMIN);
        when(userRepo.findById(1L)).thenReturn(Optional.of(admin));
        when(userRepo.findById(3L)).thenReturn(Optional.of(other));
        when(userRepo.countByRole(UserRole.ADMIN)).thenReturn(1L);

        assertThrows(ValidationException.class, () -> service.delete(1L, "admin"));
        assertThrows(IllegalStateException.class, () -> service.delete(3L, "admin"));
        verify(userRepo, never()).delete(any());
    }

    @Test
    void changeRoleRequiresRole() {
        assertThrows(ValidationException.class, () -> service.changeRole(2L, null, "admin"));
    }

    private static UserRequest request(String username, String password) {
        UserRequest r = new UserRequest();
        r.setUsername(username);
        r.setPassword(password);
        return r;
    }

    private static AppUser user(Long id, String username, UserRole role) {
        AppUser u = new AppUser();
        u.setUserId(id);
        u.setUsername(username);
        u.setRole(role);
        u.setPasswordHash("x");
        return u;
    }
}
