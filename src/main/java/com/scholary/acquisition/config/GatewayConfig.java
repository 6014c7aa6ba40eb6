package com.scholary.acquisition.config;

import com.scholary.acquisition.gateway.GatewayProperties;
import com.scholary.acquisition.gateway.SearchRateLimiter;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the gateway client and its shared search rate limiter. */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

  @Bean
  public SearchRateLimiter searchRateLimiter(GatewayProperties properties, Clock clock) {
    return new SearchRateLimiter(
        properties.maxSearchesPerWindow(),
        Duration.ofSeconds(properties.rateLimitWindowSeconds()),
        clock);
  }
}
