package com.pinclick.copilot.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.ratelimit.chatQps:0}")
    private double chatRateLimit;

    @Bean("chatRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter chatRateLimiter() {
        // 0 or negative disables limiting
        double effectiveQps = chatRateLimit > 0 ? chatRateLimit : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
