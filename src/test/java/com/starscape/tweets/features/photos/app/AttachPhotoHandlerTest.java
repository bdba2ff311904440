package com.starscape.tweets.features.photos.app;

import com.starscape.tweets.common.config.TweetsProperties;
import com.starscape.tweets.common.exception.NotFoundException;
import com.starscape.tweets.features.photos.domain.TweetPhoto;
import com.starscape.tweets.features.photos.domain.TweetPhotoRepository;
import com.starscape.tweets.features.photos.domain.TweetPhotoStatus;
import com.starscape.tweets.features.tweets.domain.Tweet;
import com.starscape.tweets.features.tweets.domain.TweetRepository;
import com.starscape.tweets.features.users.domain.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AttachPhotoHandlerTest {
    
    private static final Instant NOW = Instant.parse("2024-05-20T08:00:00Z");
    
    @Mock
    private TweetRepository tweetRepository;
    
    @Mock
    private TweetPhotoRepository photoRepository;
    
    private AttachPhotoHandler handler;
    private User owner;
    private Tweet tweet;
    
    @BeforeEach
    void setUp() {
        TweetsProperties properties = new TweetsProperties();
        properties.setPhotoUploadLimit(2);
        handler = new AttachPhotoHandler(tweetRepository, photoRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        owner = new User("user_1", "alice");
        tweet = new Tweet("tweet_1", owner, "holiday");
    }
    
    @Test
    void shouldAttachPhotoWithTweetOwnerAsUploader() {
        when(tweetRepository.findById("tweet_1")).thenReturn(Optional.of(tweet));
        when(photoRepository.countByTweetIdAndHasDeletedFalse("tweet_1")).thenReturn(1L);
        when(photoRepository.save(any(TweetPhoto.class))).thenAnswer(invocation -> invocation.getArgument(0));
        
        TweetPhoto photo = handler.handle(new AttachPhotoCommand("tweet_1", "user_1", "photos/a.jpg", 1));
        
        assertTrue(photo.getPhotoId().startsWith("tph_"));
        assertEquals("tweet_1", photo.getTweetId());
        assertEquals("user_1", photo.getUserId());
        assertSame(owner, photo.getUser());
        assertEquals(1, photo.getDisplayOrder());
        assertEquals(TweetPhotoStatus.PENDING, photo.getStatus());
        assertFalse(photo.isHasDeleted());
        assertEquals(NOW, photo.getCreatedAt());
    }
    
    @Test
    void shouldDefaultOrderToZero() {
        when(tweetRepository.findById("tweet_1")).thenReturn(Optional.of(tweet));
        when(photoRepository.countByTweetIdAndHasDeletedFalse("tweet_1")).thenReturn(0L);
        when(photoRepository.save(any(TweetPhoto.class))).thenAnswer(invocation -> invocation.getArgument(0));
        
        TweetPhoto photo = handler.handle(new AttachPhotoCommand("tweet_1", "user_1", "photos/a.jpg"));
        
        assertEquals(0, photo.getDisplayOrder());
    }
    
    @Test
    void shouldRefuseWhenUploadLimitReached() {
        when(tweetRepository.findById("tweet_1")).thenReturn(Optional.of(tweet));
        when(photoRepository.countByTweetIdAndHasDeletedFalse("tweet_1")).thenReturn(2L);
        
        assertThrows(IllegalStateException.class,
            () -> handler.handle(new AttachPhotoCommand("tweet_1", "user_1", "photos/a.jpg")));
        verify(photoRepository, never()).save(any());
    }
    
    @Test
    void shouldRefuseForeignTweet() {
        when(tweetRepository.findById("tweet_1")).thenReturn(Optional.of(tweet));
        
        assertThrows(IllegalArgumentException.class,
            () -> handler.handle(new AttachPhotoCommand("tweet_1", "user_2", "photos/a.jpg")));
        verify(photoRepository, never()).save(any());
    }
    
    @Test
    void shouldFailForUnknownTweet() {
        when(tweetRepository.findById("missing")).thenReturn(Optional.empty());
        
        assertThrows(NotFoundException.class,
            () -> handler.handle(new AttachPhotoCommand("missing", "user_1", "photos/a.jpg")));
    }
}
