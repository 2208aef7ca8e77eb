package com.hotelbot.assistant.service;

import com.hotelbot.assistant.error.NotFoundException;
import com.hotelbot.assistant.error.UnauthenticatedException;
import com.hotelbot.assistant.error.ValidationException;
import com.hotelbot.assistant.model.Review;
import com.hotelbot.assistant.repo.BookingRepository;
import com.hotelbot.assistant.repo.ReviewRepository;
import com.hotelbot.assistant.util.IdGenerator;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

@Service
public class ReviewService {
    private final ReviewRepository reviews;
    private final BookingRepository bookings;
    private final IdGenerator ids;
    private final Clock clock;

    public ReviewService(ReviewRepository reviews, BookingRepository bookings, IdGenerator ids, Clock clock) {
        this.reviews = reviews;
        this.bookings = bookings;
        this.ids = ids;
        this.clock = clock;
    }

    public Review addReview(String bookingId, String userId, Integer rating, String comment) {
        if (userId == null || userId.isBlank()) {
            throw new UnauthenticatedException();
        }
        if (bookingId == null || bookingId.isBlank()) {
            throw new ValidationException("bookingId is required");
        }
        if (rating == null || rating < 1 || rating > 5) {
            throw new ValidationException("rating must be between 1 and 5");
        }
        if (!bookings.existsById(bookingId)) {
            throw new NotFoundException("Booking not found");
        }
        Review r = new Review();
        r.setReviewId(ids.newId());
        r.setBookingId(bookingId);
        r.setUserId(userId);
        r.setRating(rating);
        r.setComment(comment);
        r.setCreatedAt(OffsetDateTime.now(clock));
        return reviews.save(r);
    }

    public List<Review> forBooking(String bookingId) {
        return reviews.findByBookingIdOrderByCreatedAtAsc(bookingId);
    }

    public List<Review> byUser(String userId) {
        return reviews.findByUserIdOrderByCreatedAtAsc(userId);
    }
}
