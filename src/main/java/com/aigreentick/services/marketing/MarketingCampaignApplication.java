package com.aigreentick.services.marketing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MarketingCampaignApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketingCampaignApplication.class, args);
    }
}
