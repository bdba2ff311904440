package com.starscape.tweets.features.photos.app;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record AttachPhotoCommand(
    @NotBlank(message = "Tweet ID is required")
    String tweetId,
    
    @NotBlank(message = "User ID is required")
    String userId,
    
    @NotBlank(message = "File reference is required")
    String file,
    
    @PositiveOrZero(message = "Order must be zero or positive")
    int order
) {
    public AttachPhotoCommand(String tweetId, String userId, String file) {
        this(tweetId, userId, file, 0);
    }
}
