package com.example.shipment_costing.security;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping
    public ResponseEntity<List<UserView>> list() {
        return ResponseEntity.ok(userService.list());
    }

    @PostMapping
    public ResponseEntity<UserView> create(@RequestBody UserRequest req, Authentication auth) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.create(req, auth.getName()));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<UserView> update(@PathVariable Long id, @RequestBody UserRequest req,
            Authentication auth) {
        boolean admin = auth.getAuthorities().stream().anyMatch(a -> "ROLE_ADMIN".equals(a.getAuthority()));
        return ResponseEntity.ok(userService.update(id, req, auth.getName(), admin));
    }

    @PatchMapping("/{id}/role")
    public ResponseEntity<UserView> changeRole(@PathVariable Long id, @RequestBody UserRequest req,
            Authentication auth) {
        return ResponseEntity.ok(userService.changeRole(id, req.getRole(), auth.getName()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Authentication auth) {
        userService.delete(id, auth.getName());
        return ResponseEntity.noContent().build();
    }
}
