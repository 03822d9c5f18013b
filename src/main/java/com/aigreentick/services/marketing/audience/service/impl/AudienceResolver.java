package com.aigreentick.services.marketing.audience.service.impl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.aigreentick.services.marketing.audience.PhoneNumbers;
import com.aigreentick.services.marketing.audience.dto.AudienceFilter;
import com.aigreentick.services.marketing.audience.service.AudienceClientService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves a filter to a trimmed, deduplicated phone list. First occurrence wins, so the
 * profile service's order is kept. Values that are not valid phone numbers are dropped.
 * An empty result is valid.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AudienceResolver {

    private final AudienceClientService audienceClientService;

    public List<String> resolve(AudienceFilter filter) {
        AudienceFilter effective = filter == null ? AudienceFilter.everyone() : filter;
        List<String> raw = audienceClientService.findPhones(effective);
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }

        Set<String> unique = new LinkedHashSet<>();
        int invalid = 0;
        for (String phone : raw) {
            if (phone == null) {
                continue;
            }
            String trimmed = phone.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (PhoneNumbers.isValid(trimmed)) {
                unique.add(trimmed);
            } else {
                invalid++;
                log.warn("Dropping invalid phone from audience: '{}'", trimmed);
            }
        }
        if (invalid > 0) {
            log.warn("Audience contained {} invalid phone numbers", invalid);
        }

        if (unique.size() < raw.size()) {
            log.debug("Audience resolved with {} duplicates, blanks or invalid values removed", raw.size() - unique.size());
        }
        return new ArrayList<>(unique);
    }
}
