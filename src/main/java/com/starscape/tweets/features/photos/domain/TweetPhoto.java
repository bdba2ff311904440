package com.starscape.tweets.features.photos.domain;

import com.starscape.tweets.features.tweets.domain.Tweet;
import com.starscape.tweets.features.users.domain.User;
import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * A media attachment of a tweet.
 *
 * The uploader is stored on the photo itself, duplicating the tweet's owner,
 * so that per-uploader queries (moderation, bans) never join through tweets.
 *
 * Deletion is two-phase: {@link #markDeleted(Instant)} flags the row and stamps
 * deletedAt; physical removal of flagged rows happens elsewhere.
 */
@Entity
@Table(name = "tweet_photos", indexes = {
    @Index(name = "tweet_photos_user_created_idx", columnList = "user_id, created_at"),
    @Index(name = "tweet_photos_deleted_created_idx", columnList = "has_deleted, created_at"),
    @Index(name = "tweet_photos_status_created_idx", columnList = "status, created_at"),
    @Index(name = "tweet_photos_tweet_order_idx", columnList = "tweet_id, display_order")
})
public class TweetPhoto extends com.starscape.tweets.common.domain.Entity<String> {
    
    @Id
    @Column(name = "photo_id")
    private String photoId;
    
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tweet_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private Tweet tweet;
    
    @Column(name = "tweet_id", insertable = false, updatable = false)
    private String tweetId;
    
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User user;
    
    @Column(name = "user_id", insertable = false, updatable = false)
    private String userId;
    
    @Column(nullable = false)
    private String file;
    
    @Column(name = "display_order", nullable = false)
    private int displayOrder;
    
    @Column(nullable = false)
    private TweetPhotoStatus status;
    
    @Column(name = "has_deleted", nullable = false)
    private boolean hasDeleted;
    
    @Column(name = "deleted_at")
    private Instant deletedAt;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected TweetPhoto() {
        // JPA constructor
    }
    
    public TweetPhoto(String photoId, Tweet tweet, User user, String file) {
        this(photoId, tweet, user, file, 0);
    }
    
    public TweetPhoto(String photoId, Tweet tweet, User user, String file, int displayOrder) {
        this(photoId, tweet, user, file, displayOrder, Instant.now());
    }
    
    public TweetPhoto(String photoId, Tweet tweet, User user, String file, int displayOrder, Instant createdAt) {
        super(photoId);
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("File cannot be blank");
        }
        if (displayOrder < 0) {
            throw new IllegalArgumentException("Display order cannot be negative");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        this.photoId = photoId;
        this.tweet = tweet;
        this.tweetId = tweet != null ? tweet.getTweetId() : null;
        this.user = user;
        this.userId = user != null ? user.getUserId() : null;
        this.file = file;
        this.displayOrder = displayOrder;
        this.status = TweetPhotoStatus.PENDING;
        this.hasDeleted = false;
        this.deletedAt = null;
        this.createdAt = createdAt;
    }
    
    @Override
    public String getId() {
        return photoId;
    }
    
    // Getters
    public String getPhotoId() { return photoId; }
    public Tweet getTweet() { return tweet; }
    public String getTweetId() { return tweetId; }
    public User getUser() { return user; }
    public String getUserId() { return userId; }
    public String getFile() { return file; }
    public int getDisplayOrder() { return displayOrder; }
    public TweetPhotoStatus getStatus() { return status; }
    public boolean isHasDeleted() { return hasDeleted; }
    public Instant getDeletedAt() { return deletedAt; }
    public Instant getCreatedAt() { return createdAt; }
    
    public boolean isUploadedBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }
    
    /**
     * Soft-delete the photo. The flag and the timestamp always move together;
     * a photo that is already deleted keeps its original deletion instant.
     */
    public void markDeleted(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("Deletion instant cannot be null");
        }
        if (hasDeleted) {
            return;
        }
        this.hasDeleted = true;
        this.deletedAt = now;
    }
    
    public void approve() {
        moderate(TweetPhotoStatus.APPROVED);
    }
    
    public void reject() {
        moderate(TweetPhotoStatus.REJECTED);
    }
    
    private void moderate(TweetPhotoStatus target) {
        if (status != TweetPhotoStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Photo %s is already %s and cannot become %s", photoId, status, target));
        }
        this.status = target;
    }
    
    @Override
    public String toString() {
        return tweetId + ": " + file;
    }
}
