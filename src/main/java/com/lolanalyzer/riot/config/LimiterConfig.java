package com.lolanalyzer.riot.config;

import com.lolanalyzer.riot.infra.MultiWindowRateLimiter;
import com.lolanalyzer.riot.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("riotLimiter")
    public RateLimiter riotLimiter(RiotApiProperties properties) {
        return new MultiWindowRateLimiter(properties.rateLimits());
    }

    @Bean("dataDragonLimiter")
    public RateLimiter dataDragonLimiter(RiotApiProperties properties) {
        return new MultiWindowRateLimiter(properties.dataDragonRateLimits());
    }
}
