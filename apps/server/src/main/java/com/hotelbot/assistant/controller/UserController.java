package com.hotelbot.assistant.controller;

import com.hotelbot.assistant.service.UserService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@CrossOrigin(origins = "*", allowCredentials = "false")
public class UserController {
    private final UserService users;

    public UserController(UserService users) {
        this.users = users;
    }

    public record RegisterRequest(String userId, String fullName, String email) {}

    public record UpdateUserRequest(String fullName, String email) {}

    @PostMapping("/register")
    public ResponseEntity<?> register(@RequestBody RegisterRequest req) {
        return ResponseEntity.ok(users.register(req.userId(), req.fullName(), req.email()));
    }

    @GetMapping("/users")
    public ResponseEntity<?> list() {
        return ResponseEntity.ok(users.list());
    }

    @PutMapping("/update-user/{userId}")
    public ResponseEntity<?> update(@PathVariable("userId") String userId, @RequestBody UpdateUserRequest req) {
        users.update(userId, req.fullName(), req.email());
        return ResponseEntity.ok(Map.of("message", "User updated successfully"));
    }
}
