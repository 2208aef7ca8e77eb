package com.hotelbot.assistant.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * The inventory service did not produce a booking. {@link Kind#REJECTED} means the
 * inventory answered and refused; {@link Kind#UNAVAILABLE} covers transport errors,
 * timeouts, 5xx answers and malformed payloads.
 */
public class BookingUpstreamException extends ResponseStatusException {
    public enum Kind { REJECTED, UNAVAILABLE }

    private final Kind kind;

    public BookingUpstreamException(Kind kind, Throwable cause) {
        super(kind == Kind.REJECTED ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.INTERNAL_SERVER_ERROR,
                kind == Kind.REJECTED ? "Booking rejected by inventory" : "Error booking room",
                cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
