package com.starscape.tweets.features.tweets.infra;

import com.starscape.tweets.features.tweets.domain.Tweet;
import com.starscape.tweets.features.tweets.domain.TweetRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JPA repository implementation for Tweet entity.
 * Latest-by-user lookups are served by the (user_id, created_at) index.
 * Read finders fetch the author eagerly so tweets render outside a session.
 */
@Repository
public interface JpaTweetRepository extends JpaRepository<Tweet, String>, TweetRepository {
    
    @Override
    @EntityGraph(attributePaths = "user")
    Optional<Tweet> findById(String tweetId);
    
    @Override
    @EntityGraph(attributePaths = "user")
    @Query("SELECT t FROM Tweet t ORDER BY t.userId ASC NULLS LAST, t.createdAt DESC")
    List<Tweet> findAllInDefaultOrder();
    
    @Override
    @EntityGraph(attributePaths = "user")
    Page<Tweet> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
}
