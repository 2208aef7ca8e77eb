package com.hotelbot.assistant.repo;

import com.hotelbot.assistant.model.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, String> {
    List<Booking> findByUserIdOrderByCheckInDateDesc(String userId);

    List<Booking> findByRoomIdOrderByCheckInDateAsc(Integer roomId);

    // Between is inclusive on both ends
    List<Booking> findByCheckInDateBetweenOrderByCheckInDateAsc(LocalDate start, LocalDate end);

    Optional<Booking> findByBookingIdAndUserId(String bookingId, String userId);

    // touches only the payment columns; returns 0 when the row is gone
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Booking b set b.paid = true, b.transactionId = :txn, b.updatedAt = :now where b.bookingId = :id")
    int markPaid(@Param("id") String bookingId, @Param("txn") String transactionId, @Param("now") OffsetDateTime now);
}
