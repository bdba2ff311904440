package com.starscape.tweets.features.photos.app;

import com.starscape.tweets.common.config.TweetsProperties;
import com.starscape.tweets.common.exception.NotFoundException;
import com.starscape.tweets.features.photos.domain.TweetPhoto;
import com.starscape.tweets.features.photos.domain.TweetPhotoRepository;
import com.starscape.tweets.features.tweets.domain.Tweet;
import com.starscape.tweets.features.tweets.domain.TweetRepository;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.util.UUID;

/**
 * Handler for attaching an already-stored media file to a tweet.
 * The photo's uploader is copied from the tweet's owner.
 */
@Service
@Validated
public class AttachPhotoHandler {
    
    private static final Logger log = LoggerFactory.getLogger(AttachPhotoHandler.class);
    
    private final TweetRepository tweetRepository;
    private final TweetPhotoRepository photoRepository;
    private final TweetsProperties properties;
    private final Clock clock;
    
    public AttachPhotoHandler(
            TweetRepository tweetRepository,
            TweetPhotoRepository photoRepository,
            TweetsProperties properties,
            Clock clock) {
        this.tweetRepository = tweetRepository;
        this.photoRepository = photoRepository;
        this.properties = properties;
        this.clock = clock;
    }
    
    @Transactional
    public TweetPhoto handle(@Valid AttachPhotoCommand command) {
        Tweet tweet = tweetRepository.findById(command.tweetId())
                .orElseThrow(() -> new NotFoundException("Tweet not found: " + command.tweetId()));
        
        // Verify ownership
        if (!tweet.isAuthoredBy(command.userId())) {
            throw new IllegalArgumentException("Tweet does not belong to user");
        }
        
        long livePhotos = photoRepository.countByTweetIdAndHasDeletedFalse(tweet.getTweetId());
        if (!properties.canAttachPhoto(livePhotos)) {
            log.warn("Photo limit reached: tweetId={}, photos={}, limit={}",
                tweet.getTweetId(), livePhotos, properties.getPhotoUploadLimit());
            throw new IllegalStateException(
                String.format("Tweet already has %d photos, limit is %d", livePhotos, properties.getPhotoUploadLimit()));
        }
        
        String photoId = "tph_" + UUID.randomUUID().toString().replace("-", "");
        TweetPhoto photo = photoRepository.save(
            new TweetPhoto(photoId, tweet, tweet.getUser(), command.file(), command.order(), clock.instant()));
        
        log.info("Attached photo: photoId={}, tweetId={}, order={}", photoId, tweet.getTweetId(), command.order());
        return photo;
    }
}
