package com.starscape.tweets.features.photos.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

public interface TweetPhotoRepository {
    TweetPhoto save(TweetPhoto photo);
    Optional<TweetPhoto> findById(String photoId);
    
    /**
     * Live photos of a tweet in display order.
     */
    List<TweetPhoto> findByTweetIdAndHasDeletedFalseOrderByDisplayOrderAsc(String tweetId);
    
    long countByTweetIdAndHasDeletedFalse(String tweetId);
    
    List<TweetPhoto> findByUserIdOrderByCreatedAtDesc(String userId);
    
    /**
     * Moderation queue: live photos in the given state, oldest first.
     */
    Page<TweetPhoto> findByStatusAndHasDeletedFalseOrderByCreatedAtAsc(TweetPhotoStatus status, Pageable pageable);
    
    Page<TweetPhoto> findByHasDeletedFalseOrderByCreatedAtDesc(Pageable pageable);
}
