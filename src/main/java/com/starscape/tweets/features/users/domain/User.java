package com.starscape.tweets.features.users.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Account that authors tweets, uploads photos and likes things.
 * Owned by the identity store; only the fields this module reads are mapped.
 */
@Entity
@Table(name = "users")
public class User extends com.starscape.tweets.common.domain.Entity<String> {
    
    public static final int MAX_USERNAME_LENGTH = 150;
    
    @Id
    @Column(name = "user_id")
    private String userId;
    
    @Column(nullable = false, unique = true, length = MAX_USERNAME_LENGTH)
    private String username;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected User() {
        // JPA constructor
    }
    
    public User(String userId, String username) {
        super(userId);
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be blank");
        }
        if (username.length() > MAX_USERNAME_LENGTH) {
            throw new IllegalArgumentException("Username must be " + MAX_USERNAME_LENGTH + " characters or less");
        }
        this.userId = userId;
        this.username = username;
        this.createdAt = Instant.now();
    }
    
    @Override
    public String getId() {
        return userId;
    }
    
    public String getUserId() {
        return userId;
    }
    
    public String getUsername() {
        return username;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    /**
     * Display form of the user.
     */
    @Override
    public String toString() {
        return username;
    }
}
