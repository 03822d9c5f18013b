package com.aigreentick.services.marketing.audience.service;

import java.util.List;

import com.aigreentick.services.marketing.audience.dto.AudienceFilter;

/**
 * Profile-service lookup of phones matching a filter, in the service's stable order.
 */
public interface AudienceClientService {

    List<String> findPhones(AudienceFilter filter);
}
