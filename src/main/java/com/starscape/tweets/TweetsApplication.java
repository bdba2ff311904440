package com.starscape.tweets;

import com.starscape.tweets.common.config.TweetsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TweetsProperties.class)
public class TweetsApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(TweetsApplication.class, args);
    }
}
