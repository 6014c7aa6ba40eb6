package com.scholary.acquisition.gateway;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the peer-network gateway (slskd).
 *
 * <p>{@code maxSearchesPerWindow} and {@code rateLimitWindowSeconds} bound how many searches we
 * start; the gateway bans clients that search too aggressively.
 */
@ConfigurationProperties(prefix = "gateway")
@Validated
public record GatewayProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @Positive int connectTimeoutSeconds,
    @Positive int requestTimeoutSeconds,
    @Positive int maxSearchesPerWindow,
    @Positive int rateLimitWindowSeconds,
    @PositiveOrZero int minimumPeerUploadSpeed) {}
