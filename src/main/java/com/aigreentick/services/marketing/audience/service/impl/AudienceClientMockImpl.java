package com.aigreentick.services.marketing.audience.service.impl;

import java.util.ArrayList;
import java.util.List;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import com.aigreentick.services.marketing.audience.config.AudienceClientProperties;
import com.aigreentick.services.marketing.audience.dto.AudienceFilter;
import com.aigreentick.services.marketing.audience.service.AudienceClientService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Deterministic synthetic audience for the 'mock' profile.
 */
@Slf4j
@Service
@Profile("mock")
@RequiredArgsConstructor
public class AudienceClientMockImpl implements AudienceClientService {

    private final AudienceClientProperties properties;

    @Override
    public List<String> findPhones(AudienceFilter filter) {
        int size = properties.getMockSize();
        List<String> phones = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            phones.add(String.format("9199%08d", i));
        }
        log.info("Mock audience generated. size={} filter={}", size, filter);
        return phones;
    }
}
