package com.starscape.tweets.features.tweets.app;

import com.starscape.tweets.common.exception.NotFoundException;
import com.starscape.tweets.features.likes.domain.Like;
import com.starscape.tweets.features.likes.domain.LikeRepository;
import com.starscape.tweets.features.tweets.domain.Tweet;
import com.starscape.tweets.features.tweets.domain.TweetRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side for tweets: latest tweets of a user, every tweet in default order,
 * and the likes of a single tweet.
 */
@Service
public class ListTweetsHandler {
    
    private static final int MAX_PAGE_SIZE = 100;
    
    private final TweetRepository tweetRepository;
    private final LikeRepository likeRepository;
    
    public ListTweetsHandler(TweetRepository tweetRepository, LikeRepository likeRepository) {
        this.tweetRepository = tweetRepository;
        this.likeRepository = likeRepository;
    }
    
    @Transactional(readOnly = true)
    public Page<Tweet> latestByUser(String userId, int page, int size) {
        size = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return tweetRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(page, size));
    }
    
    @Transactional(readOnly = true)
    public List<Tweet> all() {
        return tweetRepository.findAllInDefaultOrder();
    }
    
    @Transactional(readOnly = true)
    public List<Like> likesOf(String tweetId) {
        Tweet tweet = tweetRepository.findById(tweetId)
                .orElseThrow(() -> new NotFoundException("Tweet not found: " + tweetId));
        return tweet.likes(likeRepository);
    }
}
