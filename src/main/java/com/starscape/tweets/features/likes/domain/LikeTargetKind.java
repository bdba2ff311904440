package com.starscape.tweets.features.likes.domain;

/**
 * Kinds of rows a like can point at.
 */
public enum LikeTargetKind {
    TWEET,
    COMMENT
}
