package com.starscape.tweets.features.photos.domain;

/**
 * Moderation state of a tweet photo. Persisted as its small integer code.
 */
public enum TweetPhotoStatus {
    PENDING((short) 0),
    APPROVED((short) 1),
    REJECTED((short) 2);
    
    private final short code;
    
    TweetPhotoStatus(short code) {
        this.code = code;
    }
    
    public short code() {
        return code;
    }
    
    public static TweetPhotoStatus fromCode(short code) {
        for (TweetPhotoStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown tweet photo status code: " + code);
    }
}
