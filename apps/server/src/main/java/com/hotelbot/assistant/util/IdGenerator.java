package com.hotelbot.assistant.util;

/**
 * Source of locally generated identifiers (reviews, amenities, payment attempts,
 * simulated transaction ids).
 */
public interface IdGenerator {
    String newId();

    /** Short upper-case reference suitable for showing to a guest. */
    default String newReference() {
        String id = newId().replace("-", "").toUpperCase();
        return id.length() > 9 ? id.substring(0, 9) : id;
    }
}
