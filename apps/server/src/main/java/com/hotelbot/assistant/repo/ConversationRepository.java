package com.hotelbot.assistant.repo;

import com.hotelbot.assistant.model.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationRepository extends JpaRepository<Conversation, String> {
}
