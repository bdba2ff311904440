package com.starscape.tweets.features.tweets.app;

import com.starscape.tweets.common.exception.NotFoundException;
import com.starscape.tweets.features.likes.domain.LikeRepository;
import com.starscape.tweets.features.likes.domain.LikeTargetKind;
import com.starscape.tweets.features.tweets.domain.Tweet;
import com.starscape.tweets.features.tweets.domain.TweetRepository;
import com.starscape.tweets.features.users.domain.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ListTweetsHandlerTest {
    
    @Mock
    private TweetRepository tweetRepository;
    
    @Mock
    private LikeRepository likeRepository;
    
    private ListTweetsHandler handler;
    
    @BeforeEach
    void setUp() {
        handler = new ListTweetsHandler(tweetRepository, likeRepository);
    }
    
    @Test
    void shouldReturnEmptyLikesForTweetWithoutLikes() {
        Tweet tweet = new Tweet("tweet_1", new User("user_1", "alice"), "quiet");
        when(tweetRepository.findById("tweet_1")).thenReturn(Optional.of(tweet));
        when(likeRepository.likesFor(LikeTargetKind.TWEET, "tweet_1")).thenReturn(List.of());
        
        assertTrue(handler.likesOf("tweet_1").isEmpty());
    }
    
    @Test
    void likesOfUnknownTweetShouldFail() {
        when(tweetRepository.findById("missing")).thenReturn(Optional.empty());
        
        assertThrows(NotFoundException.class, () -> handler.likesOf("missing"));
        verifyNoInteractions(likeRepository);
    }
    
    @Test
    void latestByUserShouldClampPageSize() {
        Page<Tweet> empty = new PageImpl<>(List.of());
        when(tweetRepository.findByUserIdOrderByCreatedAtDesc("user_1", PageRequest.of(2, 100))).thenReturn(empty);
        
        assertSame(empty, handler.latestByUser("user_1", 2, 1000));
    }
}
