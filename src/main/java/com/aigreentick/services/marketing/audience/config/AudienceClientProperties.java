package com.aigreentick.services.marketing.audience.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "audience")
public class AudienceClientProperties {

    /** Base URL of the profile service. */
    private String baseUrl = "http://localhost:8085";

    private String searchPath = "/api/v1/profiles/phones";

    private Duration requestTimeout = Duration.ofSeconds(30);

    /** Number of synthetic profiles returned under the 'mock' profile. */
    private int mockSize = 1000;
}
