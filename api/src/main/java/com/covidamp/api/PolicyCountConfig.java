package com.covidamp.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PolicyCountProperties.class)
public class PolicyCountConfig {
    private static final Logger logger = LoggerFactory.getLogger(PolicyCountConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PolicyCountCache policyCountCache(PolicyCountProperties properties, Clock clock) {
        if (!properties.cacheEnabled()) {
            logger.info("[INFO] policy count caching disabled");
            return PolicyCountCache.DISABLED;
        }
        logger.info("[INFO] policy count cache maximumSize={}, expireAfterWrite={}",
            properties.cacheMaximumSize(), properties.cacheExpireAfterWrite());
        return new CaffeinePolicyCountCache(properties.cacheMaximumSize(), properties.cacheExpireAfterWrite(), clock);
    }
}
