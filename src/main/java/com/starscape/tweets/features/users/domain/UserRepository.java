package com.starscape.tweets.features.users.domain;

import java.util.Optional;

public interface UserRepository {
    User save(User user);
    Optional<User> findById(String userId);
    Optional<User> findByUsername(String username);
    boolean existsByUsername(String username);
    void delete(User user);
    void flush();
}
