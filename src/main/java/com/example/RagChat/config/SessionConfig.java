package com.example.RagChat.config;

import com.example.RagChat.session.DurableSessionStore;
import com.example.RagChat.session.RedisDurableSessionStore;
import com.example.RagChat.session.SessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class SessionConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(DurableSessionStore.class)
    public DurableSessionStore durableSessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisDurableSessionStore(redisTemplate, objectMapper);
    }

    @Bean
    public SessionStore sessionStore(DurableSessionStore durableSessionStore, Clock clock, RagChatProperties properties) {
        RagChatProperties.SessionSettings cfg = properties.getSession();
        return new SessionStore(
                durableSessionStore,
                clock,
                cfg.getTtl(),
                cfg.getReprobeInterval(),
                cfg.getMaxCasAttempts(),
                cfg.getMaxHistoryMessages(),
                cfg.getMaxHistoryChars()
        );
    }
}
