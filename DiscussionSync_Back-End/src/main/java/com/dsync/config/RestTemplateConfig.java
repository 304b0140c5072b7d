package com.dsync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestTemplateConfig {

    private static final String USER_AGENT = "discussion-sync/1.0";

    @Value("${github.token:}")
    private String githubToken;

    @Value("${discord.token:}")
    private String discordToken;

    @Value("${sync.http.connect-timeout-ms:5000}")
    private long connectTimeoutMillis;

    @Value("${sync.http.read-timeout-ms:30000}")
    private long readTimeoutMillis;

    /**
     * Client of the GitHub GraphQL API, authenticated with the personal access token.
     */
    @Bean
    public RestTemplate githubRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMillis))
                .setReadTimeout(Duration.ofMillis(readTimeoutMillis))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + githubToken.trim())
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .build();
    }

    /**
     * Client of the Discord REST API, authenticated as the bot.
     */
    @Bean
    public RestTemplate discordRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMillis))
                .setReadTimeout(Duration.ofMillis(readTimeoutMillis))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + discordToken.trim())
                // Discord rejects requests without a bot user agent
                .defaultHeader(HttpHeaders.USER_AGENT, "DiscordBot (https://discord.com/developers, 1.0) " + USER_AGENT)
                .build();
    }
}
