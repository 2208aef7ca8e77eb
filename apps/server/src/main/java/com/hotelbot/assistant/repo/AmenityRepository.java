package com.hotelbot.assistant.repo;

import com.hotelbot.assistant.model.Amenity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AmenityRepository extends JpaRepository<Amenity, String> {
    List<Amenity> findByRoomId(Integer roomId);
}
