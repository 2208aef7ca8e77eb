package com.hotelbot.assistant.service;

import com.hotelbot.assistant.error.ConflictException;
import com.hotelbot.assistant.error.NotFoundException;
import com.hotelbot.assistant.error.ValidationException;
import com.hotelbot.assistant.model.User;
import com.hotelbot.assistant.repo.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Creation paths run under a per-user lock and commit before it is released, so a
 * registration cannot be overwritten by a concurrent registration or first contact.
 */
@Service
public class UserService {
    private static final long LOCK_WAIT_MS = 5000;

    private final UserRepository users;
    private final KeyedLockService locks;
    private final Clock clock;

    public UserService(UserRepository users, KeyedLockService locks, Clock clock) {
        this.users = users;
        this.locks = locks;
        this.clock = clock;
    }

    /** Loads the user, creating it on first contact, and stamps {@code lastInteraction}. */
    public User touch(String userId) {
        return locks.withLock(lockKey(userId), LOCK_WAIT_MS, () -> {
            User u = users.findById(userId).orElseGet(() -> {
                User created = new User();
                created.setUserId(userId);
                return created;
            });
            u.setLastInteraction(OffsetDateTime.now(clock));
            return users.save(u);
        });
    }

    public User register(String userId, String fullName, String email) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        try {
            return locks.withLock(lockKey(userId), LOCK_WAIT_MS, () -> {
                if (users.existsById(userId)) {
                    throw new ConflictException("User already registered");
                }
                User u = new User();
                u.setUserId(userId);
                u.setFullName(fullName);
                u.setEmail(email);
                u.setLastInteraction(OffsetDateTime.now(clock));
                return users.save(u);
            });
        } catch (KeyedLockService.LockTimeoutException e) {
            throw new ConflictException("User registration already in progress");
        }
    }

    @Transactional
    public User update(String userId, String fullName, String email) {
        User u = users.findById(userId).orElseThrow(() -> new NotFoundException("User not found"));
        if (fullName != null) u.setFullName(fullName);
        if (email != null) u.setEmail(email);
        return users.save(u);
    }

    private static String lockKey(String userId) {
        return "user:" + userId;
    }

    public List<User> list() {
        return users.findAll();
    }
}
