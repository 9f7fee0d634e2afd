package dev.univer.notoc.service;

import dev.univer.notoc.model.User;
import dev.univer.notoc.repo.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {
    private final UserRepository userRepository;
    private final Clock clock;

    /** Creates the user on first contact; refreshes name and handle when they changed. */
    @Transactional
    public User getOrCreate(Long externalId, String displayName, String handle) {
        String name = (displayName == null || displayName.isBlank()) ? "Unknown" : displayName.trim();
        String h = normalizeHandle(handle);
        Optional<User> existing = userRepository.findByExternalId(externalId);
        if (existing.isPresent()) {
            User u = existing.get();
            if (!u.getDisplayName().equals(name)) u.setDisplayName(name);
            if (h != null && !Objects.equals(u.getHandle(), h)) u.setHandle(h);
            return u;
        }
        User u = userRepository.save(User.builder()
                                         .externalId(externalId)
                                         .displayName(name)
                                         .handle(h)
                                         .createdAt(clock.instant())
                                         .build());
        log.info("Registered user {} (external id {})", u.getId(), externalId);
        return u;
    }

    @Transactional(readOnly = true)
    public Optional<User> findByExternalId(Long externalId) {
        return userRepository.findByExternalId(externalId);
    }

    /** Case-insensitive, the leading "@" is optional. */
    @Transactional(readOnly = true)
    public Optional<User> findByHandle(String handle) {
        String h = normalizeHandle(handle);
        if (h == null) return Optional.empty();
        return userRepository.findFirstByHandleIgnoreCase(h);
    }

    static String normalizeHandle(String handle) {
        if (handle == null) return null;
        String h = handle.trim();
        if (h.startsWith("@")) h = h.substring(1);
        return h.isEmpty() ? null : h;
    }
}
