package com.taskvault.backend.global.config;

import java.time.Clock;

import com.taskvault.backend.modules.auth.application.RevocationPurgeScheduler;
import com.taskvault.backend.modules.auth.application.TokenRevocationRegistry;
import com.taskvault.backend.modules.auth.infrastructure.revocation.InMemoryTokenRevocationRegistry;
import com.taskvault.backend.modules.auth.infrastructure.revocation.RedisTokenRevocationRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Picks the revocation backing store from {@code app.auth.revocation.store}.
 * {@code memory} (default) keeps entries per process; {@code redis} shares them across instances.
 */
@Configuration(proxyBeanMethods = false)
public class RevocationStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RevocationStoreConfig.class);

    @Bean
    @ConditionalOnProperty(value = "app.auth.revocation.store", havingValue = "redis")
    public TokenRevocationRegistry redisTokenRevocationRegistry(StringRedisTemplate redisTemplate, Clock clock) {
        log.info("Token revocation backed by Redis");
        return new RedisTokenRevocationRegistry(redisTemplate, clock);
    }

    @Bean
    @ConditionalOnProperty(value = "app.auth.revocation.store", havingValue = "memory", matchIfMissing = true)
    public InMemoryTokenRevocationRegistry inMemoryTokenRevocationRegistry(Clock clock) {
        log.warn("Token revocation kept in process memory; revoked tokens stay valid on other instances");
        return new InMemoryTokenRevocationRegistry(clock);
    }

    @Bean
    public RevocationPurgeScheduler revocationPurgeScheduler(TokenRevocationRegistry registry) {
        return new RevocationPurgeScheduler(registry);
    }
}
