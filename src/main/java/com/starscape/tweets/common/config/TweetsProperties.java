package com.starscape.tweets.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for tweets and their attachments.
 * Binds to app.tweets.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.tweets")
public class TweetsProperties {
    
    private int photoUploadLimit = 9;
    
    public int getPhotoUploadLimit() {
        return photoUploadLimit;
    }
    
    public void setPhotoUploadLimit(int photoUploadLimit) {
        this.photoUploadLimit = photoUploadLimit;
    }
    
    /**
     * Check whether another photo may be attached to a tweet.
     * @param livePhotoCount photos already attached and not soft-deleted
     * @return true if the tweet is below the upload limit
     */
    public boolean canAttachPhoto(long livePhotoCount) {
        return livePhotoCount < photoUploadLimit;
    }
}
