package com.starscape.tweets.features.users.app;

import com.starscape.tweets.common.exception.NotFoundException;
import com.starscape.tweets.features.users.domain.User;
import com.starscape.tweets.features.users.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for removing a user account.
 * The user's tweets and photos stay in place with their owner cleared
 * (ON DELETE SET NULL); the user's likes go with the account (ON DELETE CASCADE).
 */
@Service
public class DeleteUserHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteUserHandler.class);
    
    private final UserRepository userRepository;
    
    public DeleteUserHandler(UserRepository userRepository) {
        this.userRepository = userRepository;
    }
    
    @Transactional
    public void handle(String userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        
        userRepository.delete(user);
        userRepository.flush();
        log.info("Deleted user: userId={}", userId);
    }
}
