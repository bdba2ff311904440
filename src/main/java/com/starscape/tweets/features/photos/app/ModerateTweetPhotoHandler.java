package com.starscape.tweets.features.photos.app;

import com.starscape.tweets.common.exception.NotFoundException;
import com.starscape.tweets.features.photos.domain.TweetPhoto;
import com.starscape.tweets.features.photos.domain.TweetPhotoRepository;
import com.starscape.tweets.features.photos.domain.TweetPhotoStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Moderation of tweet photos: the pending queue, approval and rejection.
 */
@Service
public class ModerateTweetPhotoHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ModerateTweetPhotoHandler.class);
    
    private final TweetPhotoRepository photoRepository;
    
    public ModerateTweetPhotoHandler(TweetPhotoRepository photoRepository) {
        this.photoRepository = photoRepository;
    }
    
    @Transactional(readOnly = true)
    public Page<TweetPhoto> pendingQueue(int page, int size) {
        size = Math.max(1, Math.min(size, 100));
        return photoRepository.findByStatusAndHasDeletedFalseOrderByCreatedAtAsc(
            TweetPhotoStatus.PENDING, PageRequest.of(page, size));
    }
    
    @Transactional
    public TweetPhoto approve(String photoId) {
        TweetPhoto photo = load(photoId);
        photo.approve();
        log.info("Approved photo: photoId={}", photoId);
        return photoRepository.save(photo);
    }
    
    @Transactional
    public TweetPhoto reject(String photoId) {
        TweetPhoto photo = load(photoId);
        photo.reject();
        log.info("Rejected photo: photoId={}", photoId);
        return photoRepository.save(photo);
    }
    
    private TweetPhoto load(String photoId) {
        return photoRepository.findById(photoId)
                .orElseThrow(() -> new NotFoundException("Photo not found: " + photoId));
    }
}
