package com.hotelbot.assistant.controller;

import com.hotelbot.assistant.error.UnauthenticatedException;
import com.hotelbot.assistant.model.Booking;
import com.hotelbot.assistant.service.BookingService;
import jakarta.validation.constraints.Positive;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;

@RestController
@Validated
@CrossOrigin(origins = "*", allowCredentials = "false")
public class BookingController {
    private final BookingService bookings;

    public BookingController(BookingService bookings) {
        this.bookings = bookings;
    }

    public record BookRequest(String userId, Integer roomId, String fullName, String email, Integer nights) {}

    public record CancelRequest(String bookingId, String userId) {}

    @PostMapping("/book")
    public ResponseEntity<?> book(@RequestBody BookRequest req) {
        if (req.userId() == null || req.userId().isBlank()) {
            throw new UnauthenticatedException();
        }
        BookingService.BookingResult result = bookings.book(req.userId(),
                new BookingService.BookingRequest(req.roomId(), req.fullName(), req.email(), req.nights()));
        // inventory payload as returned upstream
        return ResponseEntity.ok(result.inventoryPayload());
    }

    @GetMapping("/bookings/{userId}")
    public ResponseEntity<?> byUser(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(bookings.getBookingsForUser(userId));
    }

    @GetMapping("/bookings-by-room/{roomId}")
    public ResponseEntity<?> byRoom(@PathVariable("roomId") @Positive Integer roomId) {
        return ResponseEntity.ok(bookings.getBookingsForRoom(roomId));
    }

    @GetMapping("/bookings-in-range")
    public ResponseEntity<?> inRange(
            @RequestParam(value = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(bookings.getBookingsInRange(startDate, endDate));
    }

    @GetMapping("/booking-details/{bookingId}")
    public ResponseEntity<?> details(@PathVariable("bookingId") String bookingId) {
        return ResponseEntity.ok(bookings.getBooking(bookingId));
    }

    @PutMapping("/update-booking/{bookingId}")
    public ResponseEntity<?> update(@PathVariable("bookingId") String bookingId,
                                    @RequestBody(required = false) BookingService.BookingUpdate req) {
        Booking updated = bookings.updateBooking(bookingId, req);
        return ResponseEntity.ok(Map.of("message", "Booking updated successfully", "booking", updated));
    }

    @DeleteMapping("/delete-booking/{bookingId}")
    public ResponseEntity<?> delete(@PathVariable("bookingId") String bookingId) {
        bookings.deleteBooking(bookingId);
        return ResponseEntity.ok(Map.of("message", "Booking deleted successfully"));
    }

    @PostMapping("/cancel-booking")
    public ResponseEntity<?> cancel(@RequestBody CancelRequest req) {
        bookings.cancelBooking(req.bookingId(), req.userId());
        return ResponseEntity.ok(Map.of("message", "Booking canceled successfully"));
    }
}
