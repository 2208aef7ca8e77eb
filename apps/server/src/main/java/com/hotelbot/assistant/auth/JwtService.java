package com.hotelbot.assistant.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

@Service
public class JwtService {
    public static final String ROLE_ADMIN = "ADMIN";

    private final SecretKey key;
    private final long expiresMinutes;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.expiresMinutes:120}") long expiresMinutes
    ) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiresMinutes = expiresMinutes;
    }

    public String issueToken(String subject, String role) {
        Instant now = Instant.now();
        Instant exp = now.plusSeconds(expiresMinutes * 60);
        return Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .claim("role", role)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public Optional<ParsedToken> parse(String token) {
        try {
            Claims c = Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token).getBody();
            String role = c.get("role", String.class);
            if (c.getSubject() == null || role == null) {
                return Optional.empty();
            }
            return Optional.of(new ParsedToken(c.getSubject(), role));
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    public record ParsedToken(String subject, String role) {}
}
