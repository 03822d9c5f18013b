package com.aigreentick.services.marketing.campaign.service.impl;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.marketing.audience.PhoneNumbers;
import com.aigreentick.services.marketing.audience.dto.AudienceFilter;
import com.aigreentick.services.marketing.campaign.dto.CampaignRequest;
import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;
import com.aigreentick.services.marketing.campaign.model.Campaign;
import com.aigreentick.services.marketing.campaign.repository.CampaignRecipientRepository;
import com.aigreentick.services.marketing.campaign.repository.CampaignRepository;
import com.aigreentick.services.marketing.campaign.scheduler.RecipientBatchWriter;
import com.aigreentick.services.marketing.campaign.scheduler.RecipientSlot;
import com.aigreentick.services.marketing.config.CampaignProperties;
import com.aigreentick.services.marketing.exception.CampaignNotFoundException;
import com.aigreentick.services.marketing.exception.CampaignValidationException;
import com.aigreentick.services.marketing.exception.LifecycleViolationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignServiceImpl {

    static final int MIN_PRIORITY = 1;
    static final int MAX_PRIORITY = 10;
    static final int DEFAULT_PRIORITY = 5;
    static final int MAX_LIST_LIMIT = 500;

    private static final Pattern TEMPLATE_NAME = Pattern.compile("^[a-z0-9_]{1,100}$");
    private static final Pattern LANGUAGE_CODE = Pattern.compile("^[a-z]{2,3}(_[A-Z]{2})?$");

    private final CampaignRepository campaignRepository;
    private final CampaignRecipientRepository recipientRepository;
    private final RecipientBatchWriter recipientBatchWriter;
    private final TemplateBuilderService templateBuilderService;
    private final CampaignProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Validates and stores a new campaign in DRAFT.
     *
     * @throws CampaignValidationException listing every problem found
     */
    @Transactional
    public Campaign createCampaign(CampaignRequest request) {
        List<String> violations = validate(request);
        if (!violations.isEmpty()) {
            log.warn("Campaign rejected. name={} violations={}", request.getName(), violations);
            throw new CampaignValidationException(violations);
        }

        Campaign campaign = Campaign.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .templateName(request.getTemplateName())
                .languageCode(request.getLanguageCode())
                .templateParameters(templateBuilderService.writeParameters(request.getTemplateParameters()))
                .dailySendLimit(request.getDailySendLimit() != null ? request.getDailySendLimit() : properties.getDefaultDailyLimit())
                .priority(request.getPriority() != null ? request.getPriority() : DEFAULT_PRIORITY)
                .targetAudience(writeFilter(request.getTargetAudience()))
                .useTargetAudience(request.getUseTargetAudience() == null || request.getUseTargetAudience())
                .status(CampaignStatus.DRAFT)
                .startDate(request.getStartDate())
                .createdBy(request.getCreatedBy())
                .createdAt(LocalDateTime.now(clock))
                .build();

        Campaign saved = campaignRepository.save(campaign);
        log.info("Campaign created. id={} name={} template={} dailyLimit={} priority={}",
                saved.getId(), saved.getName(), saved.getTemplateName(), saved.getDailySendLimit(), saved.getPriority());
        return saved;
    }

    /**
     * Adds explicit phones to a DRAFT campaign. They are dated at activation, ahead of the
     * resolved audience. Phones already on the campaign are skipped.
     *
     * @return number of new recipients
     */
    @Transactional
    public int addRecipients(Long campaignId, List<String> phones) {
        Campaign campaign = getCampaign(campaignId);
        if (campaign.getStatus() != CampaignStatus.DRAFT) {
            throw new LifecycleViolationException(campaignId, campaign.getStatus(), "add recipients to");
        }

        Set<String> unique = new LinkedHashSet<>();
        List<String> invalid = new ArrayList<>();
        for (String phone : phones == null ? List.<String>of() : phones) {
            String trimmed = phone == null ? "" : phone.trim();
            if (PhoneNumbers.isValid(trimmed)) {
                unique.add(trimmed);
            } else {
                invalid.add("invalid phone number: '" + phone + "'");
            }
        }
        if (!invalid.isEmpty()) {
            throw new CampaignValidationException(invalid);
        }

        Set<String> existing = new HashSet<>(recipientRepository.findPhonesByCampaignId(campaignId));
        List<RecipientSlot> slots = unique.stream()
                .filter(phone -> !existing.contains(phone))
                .map(phone -> new RecipientSlot(phone, null))
                .toList();

        int inserted = recipientBatchWriter.insertPending(campaignId, slots, LocalDateTime.now(clock));
        log.info("Manual recipients added. campaignId={} requested={} inserted={}", campaignId, unique.size(), inserted);
        return inserted;
    }

    @Transactional(readOnly = true)
    public Campaign getCampaign(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    /**
     * Campaigns ordered by (priority, created_at), optionally restricted to one status.
     */
    @Transactional(readOnly = true)
    public List<Campaign> listCampaigns(CampaignStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIST_LIMIT)));
        return status == null
                ? campaignRepository.findAllByOrderByPriorityAscCreatedAtAscIdAsc(page)
                : campaignRepository.findByStatusOrderByPriorityAscCreatedAtAscIdAsc(status, page);
    }

    List<String> validate(CampaignRequest request) {
        List<String> violations = new ArrayList<>();

        if (request.getName() == null || request.getName().isBlank()) {
            violations.add("name is required");
        } else if (request.getName().trim().length() > 200) {
            violations.add("name must be at most 200 characters");
        }

        String template = request.getTemplateName();
        if (template == null || !TEMPLATE_NAME.matcher(template).matches()) {
            violations.add("templateName must be lowercase letters, digits or underscores");
        } else if (!properties.getApprovedTemplates().isEmpty() && !properties.getApprovedTemplates().contains(template)) {
            violations.add("template '" + template + "' is not approved");
        }

        if (request.getLanguageCode() == null || !LANGUAGE_CODE.matcher(request.getLanguageCode()).matches()) {
            violations.add("languageCode must look like 'en' or 'en_US'");
        }

        Integer limit = request.getDailySendLimit();
        if (limit != null && (limit < 1 || limit > properties.getGlobalDailyCap())) {
            violations.add("dailySendLimit must be between 1 and " + properties.getGlobalDailyCap());
        }

        Integer priority = request.getPriority();
        if (priority != null && (priority < MIN_PRIORITY || priority > MAX_PRIORITY)) {
            violations.add("priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }

        if (request.getTemplateParameters() != null
                && request.getTemplateParameters().stream().anyMatch(p -> p == null || p.isBlank())) {
            violations.add("templateParameters must not contain blank values");
        }

        if (request.getTargetAudience() != null) {
            violations.addAll(request.getTargetAudience().validate());
        }

        if (request.getStartDate() != null && request.getStartDate().isBefore(LocalDate.now(clock))) {
            violations.add("startDate must not be in the past");
        }
        return violations;
    }

    private String writeFilter(AudienceFilter filter) {
        if (filter == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(filter);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audience filter", e);
        }
    }
}
