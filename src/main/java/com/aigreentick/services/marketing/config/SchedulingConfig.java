package com.aigreentick.services.marketing.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableScheduling
@Slf4j
public class SchedulingConfig {

    /**
     * Clock that defines "today" for scheduling, dispatch and quota accounting.
     */
    @Bean
    public Clock campaignClock(CampaignProperties properties) {
        ZoneId zone = ZoneId.of(properties.getZoneId());
        log.info("Campaign clock initialized. zone={} globalDailyCap={}", zone, properties.getGlobalDailyCap());
        return Clock.system(zone);
    }
}
