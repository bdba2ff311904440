package com.starscape.tweets.features.users.infra;

import com.starscape.tweets.features.users.domain.User;
import com.starscape.tweets.features.users.domain.UserRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaUserRepository extends JpaRepository<User, String>, UserRepository {
    
    @Override
    Optional<User> findByUsername(String username);
    
    @Override
    boolean existsByUsername(String username);
}
