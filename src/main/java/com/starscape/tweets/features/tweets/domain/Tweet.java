package com.starscape.tweets.features.tweets.domain;

import com.starscape.tweets.features.likes.domain.Like;
import com.starscape.tweets.features.likes.domain.LikeRepository;
import com.starscape.tweets.features.likes.domain.LikeTargetKind;
import com.starscape.tweets.features.users.domain.User;
import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A post authored by a user.
 * The author reference is cleared, not cascaded, when the user is deleted.
 */
@Entity
@Table(name = "tweets", indexes = {
    @Index(name = "tweets_user_created_idx", columnList = "user_id, created_at")
})
public class Tweet extends com.starscape.tweets.common.domain.Entity<String> {
    
    public static final int MAX_CONTENT_LENGTH = 255;
    
    @Id
    @Column(name = "tweet_id")
    private String tweetId;
    
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User user;
    
    @Column(name = "user_id", insertable = false, updatable = false)
    private String userId;
    
    @Column(nullable = false, length = MAX_CONTENT_LENGTH)
    private String content;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected Tweet() {
        // JPA constructor
    }
    
    public Tweet(String tweetId, User user, String content) {
        this(tweetId, user, content, Instant.now());
    }
    
    public Tweet(String tweetId, User user, String content, Instant createdAt) {
        super(tweetId);
        if (content == null) {
            throw new IllegalArgumentException("Content cannot be null");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Content must be %d characters or less, got %d", MAX_CONTENT_LENGTH, content.length()));
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        this.tweetId = tweetId;
        this.user = user;
        this.userId = user != null ? user.getUserId() : null;
        this.content = content;
        this.createdAt = createdAt;
    }
    
    @Override
    public String getId() {
        return tweetId;
    }
    
    // Getters
    public String getTweetId() { return tweetId; }
    public User getUser() { return user; }
    public String getUserId() { return userId; }
    public String getContent() { return content; }
    public Instant getCreatedAt() { return createdAt; }
    
    public boolean isAuthoredBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }
    
    /**
     * Whole hours elapsed since the tweet was posted, measured against the system UTC clock.
     */
    public long hoursToNow() {
        return hoursToNow(Clock.systemUTC());
    }
    
    /**
     * Whole hours elapsed since the tweet was posted.
     * Never negative: a clock behind {@code createdAt} yields 0.
     */
    public long hoursToNow(Clock clock) {
        Duration elapsed = Duration.between(createdAt, clock.instant());
        if (elapsed.isNegative()) {
            return 0;
        }
        return elapsed.toHours();
    }
    
    /**
     * Likes on this tweet, most recent first.
     */
    public List<Like> likes(LikeRepository likeRepository) {
        return likeRepository.likesFor(LikeTargetKind.TWEET, tweetId);
    }
    
    @Override
    public String toString() {
        return createdAt + " " + user + ": " + content;
    }
}
