package com.hotelbot.assistant.controller;

import com.hotelbot.assistant.model.Amenity;
import com.hotelbot.assistant.service.AmenityService;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@Validated
@CrossOrigin(origins = "*", allowCredentials = "false")
public class AmenityController {
    private final AmenityService amenities;

    public AmenityController(AmenityService amenities) {
        this.amenities = amenities;
    }

    public record AmenityRequest(String amenityId, String name, String description, Integer roomId) {}

    @PostMapping("/amenities")
    public ResponseEntity<?> create(@RequestBody AmenityRequest req) {
        return ResponseEntity.ok(amenities.create(req.amenityId(), req.name(), req.description(), req.roomId()));
    }

    @GetMapping("/amenities")
    public ResponseEntity<?> list() {
        return ResponseEntity.ok(amenities.list());
    }

    @PutMapping("/amenities/{amenityId}")
    public ResponseEntity<?> update(@PathVariable("amenityId") @NotBlank String amenityId, @RequestBody AmenityRequest req) {
        Amenity updated = amenities.update(amenityId, req.name(), req.description(), req.roomId());
        return ResponseEntity.ok(Map.of("message", "Amenity updated successfully", "amenity", updated));
    }

    @DeleteMapping("/amenities/{amenityId}")
    public ResponseEntity<?> delete(@PathVariable("amenityId") String amenityId) {
        amenities.delete(amenityId);
        return ResponseEntity.ok(Map.of("message", "Amenity deleted successfully"));
    }

    @GetMapping("/room-amenities/{roomId}")
    public ResponseEntity<?> forRoom(@PathVariable("roomId") @Positive Integer roomId) {
        return ResponseEntity.ok(amenities.forRoom(roomId));
    }
}
