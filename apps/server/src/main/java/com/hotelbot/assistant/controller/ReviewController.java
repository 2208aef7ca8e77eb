package com.hotelbot.assistant.controller;

import com.hotelbot.assistant.service.ReviewService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@CrossOrigin(origins = "*", allowCredentials = "false")
public class ReviewController {
    private final ReviewService reviews;

    public ReviewController(ReviewService reviews) {
        this.reviews = reviews;
    }

    public record ReviewRequest(String bookingId, String userId, Integer rating, String comment) {}

    @PostMapping("/add-review")
    public ResponseEntity<?> add(@RequestBody ReviewRequest req) {
        return ResponseEntity.ok(reviews.addReview(req.bookingId(), req.userId(), req.rating(), req.comment()));
    }

    @GetMapping("/reviews/{bookingId}")
    public ResponseEntity<?> forBooking(@PathVariable("bookingId") String bookingId) {
        return ResponseEntity.ok(reviews.forBooking(bookingId));
    }

    @GetMapping("/reviews-by-user/{userId}")
    public ResponseEntity<?> byUser(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(reviews.byUser(userId));
    }
}
