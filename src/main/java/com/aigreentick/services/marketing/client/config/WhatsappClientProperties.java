package com.aigreentick.services.marketing.client.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;
import lombok.ToString;

@Data
@ConfigurationProperties(prefix = "whatsapp")
public class WhatsappClientProperties {

    private String baseUrl = "https://graph.facebook.com";

    private String apiVersion = "v19.0";

    private String phoneNumberId;

    @ToString.Exclude
    private String accessToken;

    /** When false the real client refuses to call the provider. */
    private boolean outgoingEnabled = true;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(15);

    /** Upper bound on a whole send call, including connection setup. */
    private Duration requestTimeout = Duration.ofSeconds(20);
}
