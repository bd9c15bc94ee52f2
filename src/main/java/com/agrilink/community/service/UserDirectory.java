package com.agrilink.community.service;

import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.domain.model.User;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves user ids into the summaries embedded in products, tips, stories and messages.
 * Lists are resolved with one query per page.
 *
 * @author AgriLink Team
 */
@Service
@Transactional(readOnly = true)
public class UserDirectory {

    private final UserRepository userRepository;

    public UserDirectory(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public User getUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    /**
     * @return Summary, or null when the user no longer exists
     */
    public UserSummary summary(Long userId) {
        if (userId == null) {
            return null;
        }
        return userRepository.findById(userId).map(UserSummary::fromEntity).orElse(null);
    }

    /**
     * Resolve many users at once. Missing users are absent from the map.
     */
    public Map<Long, UserSummary> summaries(Collection<Long> userIds) {
        Set<Long> ids = new HashSet<>(userIds);
        ids.removeIf(Objects::isNull);
        Map<Long, UserSummary> result = new HashMap<>();
        if (ids.isEmpty()) {
            return result;
        }
        for (User user : userRepository.findAllById(ids)) {
            result.put(user.getId(), UserSummary.fromEntity(user));
        }
        return result;
    }
}
