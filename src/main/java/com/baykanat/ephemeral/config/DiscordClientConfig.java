package com.baykanat.ephemeral.config;

import com.baykanat.ephemeral.infrastructure.discord.DiscordRateLimit;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/** Discord REST API istemcisi (bot token ve User-Agent varsayılan header) ve 429 bekleme politikası. */
@Configuration
@RequiredArgsConstructor
public class DiscordClientConfig {

    private final AppProperties appProperties;

    @Bean
    public RestClient discordRestClient(RestClient.Builder builder) {
        AppProperties.DiscordProperties discord = appProperties.getDiscord();
        return builder
                .baseUrl(discord.getApiBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + discord.getToken())
                .defaultHeader(HttpHeaders.USER_AGENT, "DiscordBot (ephemeral-scheduler, 1.0.0)")
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /** Discord 429 yanıtlarını bildirilen süre kadar bekleyip tekrarlar; diğer hatalar doğrudan yükselir. */
    @Bean
    public Retry discordRateLimitRetry(RetryRegistry retryRegistry) {
        AppProperties.DiscordProperties discord = appProperties.getDiscord();
        return DiscordRateLimit.retry("discordRateLimit", retryRegistry,
                discord.getRateLimitMaxAttempts(), discord.getRateLimitMaxWait());
    }
}
