package com.starscape.tweets.features.photos.infra;

import com.starscape.tweets.features.photos.domain.TweetPhoto;
import com.starscape.tweets.features.photos.domain.TweetPhotoRepository;
import com.starscape.tweets.features.photos.domain.TweetPhotoStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA repository implementation for TweetPhoto entity.
 * Each finder lines up with one of the composite indexes on tweet_photos.
 */
@Repository
public interface JpaTweetPhotoRepository extends JpaRepository<TweetPhoto, String>, TweetPhotoRepository {
    
    @Override
    List<TweetPhoto> findByTweetIdAndHasDeletedFalseOrderByDisplayOrderAsc(String tweetId);
    
    @Override
    long countByTweetIdAndHasDeletedFalse(String tweetId);
    
    @Override
    List<TweetPhoto> findByUserIdOrderByCreatedAtDesc(String userId);
    
    @Override
    Page<TweetPhoto> findByStatusAndHasDeletedFalseOrderByCreatedAtAsc(TweetPhotoStatus status, Pageable pageable);
    
    @Override
    Page<TweetPhoto> findByHasDeletedFalseOrderByCreatedAtDesc(Pageable pageable);
}
