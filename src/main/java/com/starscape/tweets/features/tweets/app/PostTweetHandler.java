package com.starscape.tweets.features.tweets.app;

import com.starscape.tweets.common.exception.NotFoundException;
import com.starscape.tweets.features.tweets.domain.Tweet;
import com.starscape.tweets.features.tweets.domain.TweetRepository;
import com.starscape.tweets.features.users.domain.User;
import com.starscape.tweets.features.users.domain.UserRepository;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.util.UUID;

/**
 * Handler for posting a new tweet on behalf of a user.
 */
@Service
@Validated
public class PostTweetHandler {
    
    private static final Logger log = LoggerFactory.getLogger(PostTweetHandler.class);
    
    private final TweetRepository tweetRepository;
    private final UserRepository userRepository;
    private final Clock clock;
    
    public PostTweetHandler(TweetRepository tweetRepository, UserRepository userRepository, Clock clock) {
        this.tweetRepository = tweetRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }
    
    @Transactional
    public Tweet handle(@Valid PostTweetCommand command) {
        User user = userRepository.findById(command.userId())
                .orElseThrow(() -> new NotFoundException("User not found: " + command.userId()));
        
        String tweetId = "tweet_" + UUID.randomUUID().toString().replace("-", "");
        Tweet tweet = tweetRepository.save(new Tweet(tweetId, user, command.content(), clock.instant()));
        
        log.info("Posted tweet: tweetId={}, userId={}, length={}", tweetId, user.getUserId(), command.content().length());
        return tweet;
    }
}
