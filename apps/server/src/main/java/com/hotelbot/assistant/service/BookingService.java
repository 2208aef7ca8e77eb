package com.hotelbot.assistant.service;

import com.hotelbot.assistant.error.BookingUpstreamException;
import com.hotelbot.assistant.error.NotFoundException;
import com.hotelbot.assistant.error.ValidationException;
import com.hotelbot.assistant.inventory.InventoryClient;
import com.hotelbot.assistant.inventory.InventoryException;
import com.hotelbot.assistant.model.Booking;
import com.hotelbot.assistant.repo.BookingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Creates bookings through the inventory service and keeps the local ledger in step with it.
 * The inventory assigns the booking id and the price; stay dates are computed here.
 */
@Service
public class BookingService {
    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private final BookingRepository bookings;
    private final InventoryClient inventory;
    private final Clock clock;
    private final int persistMaxAttempts;

    public BookingService(BookingRepository bookings,
                          InventoryClient inventory,
                          Clock clock,
                          @Value("${booking.persist.maxAttempts:3}") int persistMaxAttempts) {
        this.bookings = bookings;
        this.inventory = inventory;
        this.clock = clock;
        this.persistMaxAttempts = Math.max(1, persistMaxAttempts);
    }

    public record BookingRequest(Integer roomId, String fullName, String email, Integer nights) {}

    public record BookingResult(Booking booking, Map<String, Object> inventoryPayload) {}

    public record BookingUpdate(Integer roomId, LocalDate checkInDate, LocalDate checkOutDate) {}

    public BookingResult book(String ownerId, BookingRequest req) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        if (req == null || req.roomId() == null || req.fullName() == null || req.fullName().isBlank()
                || req.email() == null || req.email().isBlank() || req.nights() == null) {
            throw new ValidationException("roomId, fullName, email and nights are required");
        }
        if (req.roomId() <= 0) {
            throw new ValidationException("roomId must be positive");
        }
        if (req.nights() <= 0) {
            throw new ValidationException("nights must be a positive integer");
        }

        InventoryClient.InventoryBooking remote;
        try {
            remote = inventory.book(req.roomId(), req.fullName().trim(), req.email().trim(), req.nights());
        } catch (InventoryException e) {
            BookingUpstreamException.Kind kind = e.isRejected()
                    ? BookingUpstreamException.Kind.REJECTED
                    : BookingUpstreamException.Kind.UNAVAILABLE;
            log.warn("Inventory booking failed: owner={}, roomId={}, kind={}, status={}",
                    ownerId, req.roomId(), kind, e.getHttpStatus());
            throw new BookingUpstreamException(kind, e);
        }

        LocalDate checkIn = LocalDate.now(clock);
        Booking b = new Booking();
        b.setBookingId(remote.bookingId());
        b.setUserId(ownerId);
        b.setGuestName(req.fullName().trim());
        b.setGuestEmail(req.email().trim());
        b.setRoomId(req.roomId());
        b.setCheckInDate(checkIn);
        b.setCheckOutDate(checkIn.plusDays(req.nights()));
        b.setNights(req.nights());
        b.setTotalAmount(remote.totalPrice());
        b.setPaid(false);
        b.setCreatedAt(OffsetDateTime.now(clock));
        b.setUpdatedAt(OffsetDateTime.now(clock));

        Booking saved = persist(b);
        log.info("Booking created: bookingId={}, owner={}, roomId={}, {} -> {}, total={}",
                saved.getBookingId(), ownerId, saved.getRoomId(), saved.getCheckInDate(), saved.getCheckOutDate(), saved.getTotalAmount());
        return new BookingResult(saved, remote.payload());
    }

    // save() merges on the primary key, so a retry after a partial failure cannot duplicate the row
    private Booking persist(Booking b) {
        DataAccessException last = null;
        for (int attempt = 1; attempt <= persistMaxAttempts; attempt++) {
            try {
                return bookings.save(b);
            } catch (DataAccessException e) {
                last = e;
                log.warn("Persisting booking {} failed (attempt {}/{}): {}", b.getBookingId(), attempt, persistMaxAttempts, e.toString());
            }
        }
        log.error("ORPHANED booking: inventory bookingId={} exists upstream but could not be stored locally (owner={}, roomId={})",
                b.getBookingId(), b.getUserId(), b.getRoomId(), last);
        throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Error booking room", last);
    }

    public Booking getBooking(String bookingId) {
        return bookings.findById(bookingId).orElseThrow(() -> new NotFoundException("Booking not found"));
    }

    public List<Booking> getBookingsForUser(String userId) {
        return bookings.findByUserIdOrderByCheckInDateDesc(userId);
    }

    public List<Booking> getBookingsForRoom(Integer roomId) {
        return bookings.findByRoomIdOrderByCheckInDateAsc(roomId);
    }

    public List<Booking> getBookingsInRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new ValidationException("startDate and endDate are required");
        }
        if (start.isAfter(end)) {
            throw new ValidationException("startDate must not be after endDate");
        }
        return bookings.findByCheckInDateBetweenOrderByCheckInDateAsc(start, end);
    }

    @Transactional
    public Booking updateBooking(String bookingId, BookingUpdate update) {
        Booking b = bookings.findById(bookingId).orElseThrow(() -> new NotFoundException("Booking not found"));
        if (update == null) {
            return b;
        }
        if (update.roomId() != null) {
            if (update.roomId() <= 0) throw new ValidationException("roomId must be positive");
            b.setRoomId(update.roomId());
        }
        LocalDate in = update.checkInDate() != null ? update.checkInDate() : b.getCheckInDate();
        LocalDate out = update.checkOutDate() != null ? update.checkOutDate() : b.getCheckOutDate();
        if (!out.isAfter(in)) {
            throw new ValidationException("checkOutDate must be after checkInDate");
        }
        b.setCheckInDate(in);
        b.setCheckOutDate(out);
        b.setNights((int) ChronoUnit.DAYS.between(in, out));
        b.setUpdatedAt(OffsetDateTime.now(clock));
        return bookings.save(b);
    }

    /**
     * Removes the local booking if {@code userId} owns it. The inventory is not notified;
     * it exposes no cancellation endpoint.
     */
    @Transactional
    public void cancelBooking(String bookingId, String userId) {
        if (bookingId == null || bookingId.isBlank() || userId == null || userId.isBlank()) {
            throw new ValidationException("bookingId and userId are required");
        }
        Booking b = bookings.findByBookingIdAndUserId(bookingId, userId)
                .orElseThrow(() -> new NotFoundException("Booking not found"));
        bookings.delete(b);
        log.info("Booking cancelled locally: bookingId={}, owner={}, paid={}", bookingId, userId, b.isPaid());
    }

    @Transactional
    public void deleteBooking(String bookingId) {
        Booking b = bookings.findById(bookingId).orElseThrow(() -> new NotFoundException("Booking not found"));
        bookings.delete(b);
        log.info("Booking deleted: bookingId={}", bookingId);
    }
}
