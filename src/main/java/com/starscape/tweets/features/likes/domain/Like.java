package com.starscape.tweets.features.likes.domain;

import com.starscape.tweets.features.users.domain.User;
import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * A user's like of some target row.
 * The target is a tagged reference (kind + id) rather than a foreign key,
 * so one table serves likes on tweets, comments and anything added later.
 * Mapped under the entity name LikeEntry since LIKE is a query keyword.
 */
@Entity(name = "LikeEntry")
@Table(name = "likes",
    uniqueConstraints = {
        @UniqueConstraint(name = "likes_target_user_unique", columnNames = {"target_kind", "target_id", "user_id"})
    },
    indexes = {
        @Index(name = "likes_target_created_idx", columnList = "target_kind, target_id, created_at")
    })
public class Like extends com.starscape.tweets.common.domain.Entity<String> {
    
    @Id
    @Column(name = "like_id")
    private String likeId;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "target_kind", nullable = false, length = 32)
    private LikeTargetKind targetKind;
    
    @Column(name = "target_id", nullable = false)
    private String targetId;
    
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected Like() {
        // JPA constructor
    }
    
    public Like(String likeId, LikeTargetKind targetKind, String targetId, User user) {
        this(likeId, targetKind, targetId, user, Instant.now());
    }
    
    public Like(String likeId, LikeTargetKind targetKind, String targetId, User user, Instant createdAt) {
        super(likeId);
        if (targetKind == null) {
            throw new IllegalArgumentException("Target kind cannot be null");
        }
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("Target ID cannot be blank");
        }
        if (user == null) {
            throw new IllegalArgumentException("User cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        this.likeId = likeId;
        this.targetKind = targetKind;
        this.targetId = targetId;
        this.user = user;
        this.createdAt = createdAt;
    }
    
    @Override
    public String getId() {
        return likeId;
    }
    
    public String getLikeId() { return likeId; }
    public LikeTargetKind getTargetKind() { return targetKind; }
    public String getTargetId() { return targetId; }
    public User getUser() { return user; }
    public Instant getCreatedAt() { return createdAt; }
    
    public boolean targets(LikeTargetKind kind, String id) {
        return targetKind == kind && targetId.equals(id);
    }
    
    @Override
    public String toString() {
        return createdAt + " " + user + " liked " + targetKind + ":" + targetId;
    }
}
