package com.starscape.tweets.features.photos.app;

import com.starscape.tweets.common.exception.NotFoundException;
import com.starscape.tweets.features.photos.domain.TweetPhoto;
import com.starscape.tweets.features.photos.domain.TweetPhotoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Handler for soft-deleting tweet photos.
 * Flags the photo and stamps deletedAt; the row stays until a later purge.
 */
@Service
public class DeleteTweetPhotoHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteTweetPhotoHandler.class);
    
    private final TweetPhotoRepository photoRepository;
    private final Clock clock;
    
    public DeleteTweetPhotoHandler(TweetPhotoRepository photoRepository, Clock clock) {
        this.photoRepository = photoRepository;
        this.clock = clock;
    }
    
    @Transactional
    public void handle(String photoId, String userId) {
        TweetPhoto photo = photoRepository.findById(photoId)
                .orElseThrow(() -> new NotFoundException("Photo not found: " + photoId));
        
        // Verify ownership
        if (!photo.isUploadedBy(userId)) {
            throw new IllegalArgumentException("Photo does not belong to user");
        }
        
        if (photo.isHasDeleted()) {
            log.debug("Photo already deleted: photoId={}", photoId);
            return;
        }
        
        photo.markDeleted(clock.instant());
        photoRepository.save(photo);
        log.info("Soft-deleted photo: photoId={}, userId={}", photoId, userId);
    }
}
