package com.starscape.tweets.features.tweets.app;

import com.starscape.tweets.features.tweets.domain.Tweet;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record PostTweetCommand(
    @NotBlank(message = "User ID is required")
    String userId,
    
    @NotNull(message = "Content is required")
    @Size(max = Tweet.MAX_CONTENT_LENGTH, message = "Content must be 255 characters or less")
    String content
) {}
