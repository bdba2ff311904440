package com.starscape.tweets.features.likes.infra;

import com.starscape.tweets.features.likes.domain.Like;
import com.starscape.tweets.features.likes.domain.LikeRepository;
import com.starscape.tweets.features.likes.domain.LikeTargetKind;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JPA repository implementation for likes.
 * Lookups by target use the (target_kind, target_id, created_at) index
 * and fetch the liker with the row.
 */
@Repository
public interface JpaLikeRepository extends JpaRepository<Like, String>, LikeRepository {
    
    @Override
    @EntityGraph(attributePaths = "user")
    @Query("SELECT l FROM LikeEntry l WHERE l.targetKind = :targetKind AND l.targetId = :targetId ORDER BY l.createdAt DESC")
    List<Like> likesFor(@Param("targetKind") LikeTargetKind targetKind, @Param("targetId") String targetId);
    
    @Override
    long countByTargetKindAndTargetId(LikeTargetKind targetKind, String targetId);
    
    @Override
    @EntityGraph(attributePaths = "user")
    Optional<Like> findByTargetKindAndTargetIdAndUserUserId(LikeTargetKind targetKind, String targetId, String userId);
}
