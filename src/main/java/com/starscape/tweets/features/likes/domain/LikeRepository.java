package com.starscape.tweets.features.likes.domain;

import java.util.List;
import java.util.Optional;

public interface LikeRepository {
    Like save(Like like);
    void delete(Like like);
    
    /**
     * Likes pointing at the given target, most recent first.
     */
    List<Like> likesFor(LikeTargetKind targetKind, String targetId);
    
    long countByTargetKindAndTargetId(LikeTargetKind targetKind, String targetId);
    Optional<Like> findByTargetKindAndTargetIdAndUserUserId(LikeTargetKind targetKind, String targetId, String userId);
}
