package com.hotelbot.assistant.repo;

import com.hotelbot.assistant.model.User;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<User, String> {
}
