package com.hotelbot.assistant.auth;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Optional;

public class JwtServiceTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-0123456789";

    @Test
    public void shouldRoundTripAdminToken() {
        JwtService jwt = new JwtService(SECRET, 5);

        Optional<JwtService.ParsedToken> parsed = jwt.parse(jwt.issueToken("admin", "ADMIN"));

        Assertions.assertTrue(parsed.isPresent());
        Assertions.assertEquals("admin", parsed.get().subject());
        Assertions.assertEquals("ADMIN", parsed.get().role());
    }

    @Test
    public void shouldRejectTokenSignedWithOtherKey() {
        String foreign = new JwtService("another-secret-another-secret-another-0123", 5).issueToken("admin", "ADMIN");

        Assertions.assertTrue(new JwtService(SECRET, 5).parse(foreign).isEmpty());
    }

    @Test
    public void shouldRejectGarbage() {
        Assertions.assertTrue(new JwtService(SECRET, 5).parse("not.a.token").isEmpty());
    }
}
