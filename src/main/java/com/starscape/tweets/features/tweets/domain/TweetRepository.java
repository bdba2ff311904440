package com.starscape.tweets.features.tweets.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

public interface TweetRepository {
    Tweet save(Tweet tweet);
    Optional<Tweet> findById(String tweetId);
    void delete(Tweet tweet);
    long count();
    
    /**
     * All tweets grouped by author, each author's tweets newest first.
     */
    List<Tweet> findAllInDefaultOrder();
    
    Page<Tweet> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
}
