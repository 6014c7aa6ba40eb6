package com.scholary.acquisition.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the acquisition pipeline.
 *
 * <p>Enables the AcquisitionProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(AcquisitionProperties.class)
public class AcquisitionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
