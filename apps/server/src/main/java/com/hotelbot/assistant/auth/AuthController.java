package com.hotelbot.assistant.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/auth")
@CrossOrigin(origins = "*", allowCredentials = "false")
public class AuthController {
    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final PasswordEncoder encoder;
    private final JwtService jwt;
    private final String adminUsername;
    private final String adminPasswordHash;

    public AuthController(PasswordEncoder encoder,
                          JwtService jwt,
                          @Value("${admin.username:admin}") String adminUsername,
                          @Value("${admin.passwordHash:}") String adminPasswordHash) {
        this.encoder = encoder;
        this.jwt = jwt;
        this.adminUsername = adminUsername;
        this.adminPasswordHash = adminPasswordHash;
    }

    public record AdminLoginRequest(String username, String password) {}

    public record AuthResponse(String token) {}

    @PostMapping("/admin/login")
    public ResponseEntity<?> login(@RequestBody AdminLoginRequest req) {
        if (req.username() == null || req.password() == null || req.username().isBlank() || req.password().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("status", 400, "error", "username and password are required"));
        }
        if (adminPasswordHash == null || adminPasswordHash.isBlank()) {
            log.warn("Admin login attempted but admin.passwordHash is not configured");
            return ResponseEntity.status(401).body(Map.of("status", 401, "error", "Invalid credentials"));
        }
        if (!adminUsername.equals(req.username()) || !encoder.matches(req.password(), adminPasswordHash)) {
            return ResponseEntity.status(401).body(Map.of("status", 401, "error", "Invalid credentials"));
        }
        return ResponseEntity.ok(new AuthResponse(jwt.issueToken(adminUsername, JwtService.ROLE_ADMIN)));
    }
}
