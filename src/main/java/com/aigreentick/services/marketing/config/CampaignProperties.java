package com.aigreentick.services.marketing.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Validated
@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

    /** Provider cap on messages sent per calendar day, across all campaigns. */
    @Min(1)
    private int globalDailyCap = 250;

    @Min(1)
    private int defaultDailyLimit = 250;

    @Min(0)
    private int maxRetries = 3;

    @NotNull
    private Duration retryBackoff = Duration.ofMinutes(15);

    /** A claim older than this is considered abandoned by a crashed dispatch run. */
    @NotNull
    private Duration claimLease = Duration.ofMinutes(10);

    @NotBlank
    private String zoneId = "UTC";

    /** Empty means any well-formed template name is accepted. */
    private List<String> approvedTemplates = new ArrayList<>();

    private Dispatch dispatch = new Dispatch();

    private Reconcile reconcile = new Reconcile();

    @Data
    public static class Dispatch {
        private boolean enabled = true;
        private String cron = "0 */5 * * * *";
        @Min(1)
        private int pageSize = 100;
    }

    @Data
    public static class Reconcile {
        @Min(1)
        private int heldMaxAttempts = 10;
        @NotNull
        private Duration heldMaxAge = Duration.ofHours(1);
        @NotNull
        private Duration heldRetryDelay = Duration.ofMinutes(1);
        private long heldReplayIntervalMs = 60000;
        @Min(1)
        private int heldBatchSize = 200;
    }
}
