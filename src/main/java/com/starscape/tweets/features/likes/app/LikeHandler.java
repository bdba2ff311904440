package com.starscape.tweets.features.likes.app;

import com.starscape.tweets.common.exception.NotFoundException;
import com.starscape.tweets.features.likes.domain.Like;
import com.starscape.tweets.features.likes.domain.LikeRepository;
import com.starscape.tweets.features.likes.domain.LikeTargetKind;
import com.starscape.tweets.features.tweets.domain.TweetRepository;
import com.starscape.tweets.features.users.domain.User;
import com.starscape.tweets.features.users.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Handler for liking and unliking targets.
 * Both operations are idempotent per (target, user).
 */
@Service
public class LikeHandler {
    
    private static final Logger log = LoggerFactory.getLogger(LikeHandler.class);
    
    private final LikeRepository likeRepository;
    private final UserRepository userRepository;
    private final TweetRepository tweetRepository;
    private final Clock clock;
    
    public LikeHandler(
            LikeRepository likeRepository,
            UserRepository userRepository,
            TweetRepository tweetRepository,
            Clock clock) {
        this.likeRepository = likeRepository;
        this.userRepository = userRepository;
        this.tweetRepository = tweetRepository;
        this.clock = clock;
    }
    
    @Transactional
    public Like like(LikeTargetKind targetKind, String targetId, String userId) {
        Optional<Like> existing = likeRepository.findByTargetKindAndTargetIdAndUserUserId(targetKind, targetId, userId);
        if (existing.isPresent()) {
            log.debug("Already liked: target={}:{}, userId={}", targetKind, targetId, userId);
            return existing.get();
        }
        
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        
        if (targetKind == LikeTargetKind.TWEET && tweetRepository.findById(targetId).isEmpty()) {
            throw new NotFoundException("Tweet not found: " + targetId);
        }
        
        String likeId = "like_" + UUID.randomUUID().toString().replace("-", "");
        Like like = likeRepository.save(new Like(likeId, targetKind, targetId, user, clock.instant()));
        log.info("Liked: likeId={}, target={}:{}, userId={}", likeId, targetKind, targetId, userId);
        return like;
    }
    
    /**
     * @return true if a like was removed
     */
    @Transactional
    public boolean unlike(LikeTargetKind targetKind, String targetId, String userId) {
        Optional<Like> existing = likeRepository.findByTargetKindAndTargetIdAndUserUserId(targetKind, targetId, userId);
        if (existing.isEmpty()) {
            return false;
        }
        likeRepository.delete(existing.get());
        log.info("Unliked: target={}:{}, userId={}", targetKind, targetId, userId);
        return true;
    }
}
