package com.hotelbot.assistant.service;

import com.hotelbot.assistant.error.ConflictException;
import com.hotelbot.assistant.error.NotFoundException;
import com.hotelbot.assistant.error.ValidationException;
import com.hotelbot.assistant.model.Amenity;
import com.hotelbot.assistant.repo.AmenityRepository;
import com.hotelbot.assistant.util.IdGenerator;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Amenities are kept locally; the rooms they attach to live in the inventory, so
 * {@code roomId} is not checked against anything here.
 */
@Service
public class AmenityService {
    private final AmenityRepository amenities;
    private final IdGenerator ids;

    public AmenityService(AmenityRepository amenities, IdGenerator ids) {
        this.amenities = amenities;
        this.ids = ids;
    }

    @Transactional
    public Amenity create(String amenityId, String name, String description, Integer roomId) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        String id = (amenityId == null || amenityId.isBlank()) ? ids.newId() : amenityId.trim();
        if (amenities.existsById(id)) {
            throw new ConflictException("Amenity already exists");
        }
        Amenity a = new Amenity();
        a.setAmenityId(id);
        a.setName(name.trim());
        a.setDescription(description);
        a.setRoomId(roomId);
        return amenities.save(a);
    }

    public List<Amenity> list() {
        return amenities.findAll();
    }

    public List<Amenity> forRoom(Integer roomId) {
        return amenities.findByRoomId(roomId);
    }

    @Transactional
    public Amenity update(String amenityId, String name, String description, Integer roomId) {
        Amenity a = amenities.findById(amenityId).orElseThrow(() -> new NotFoundException("Amenity not found"));
        if (name != null) {
            if (name.isBlank()) throw new ValidationException("name must not be blank");
            a.setName(name.trim());
        }
        if (description != null) a.setDescription(description);
        if (roomId != null) a.setRoomId(roomId);
        return amenities.save(a);
    }

    @Transactional
    public void delete(String amenityId) {
        Amenity a = amenities.findById(amenityId).orElseThrow(() -> new NotFoundException("Amenity not found"));
        amenities.delete(a);
    }
}
