package com.aigreentick.services.marketing.client.service.impl;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import com.aigreentick.services.marketing.client.dto.ProviderResponse;
import com.aigreentick.services.marketing.client.dto.SendTemplateMessageResponse;
import com.aigreentick.services.marketing.client.dto.SendTemplateMessageResponse.WhatsAppContactDto;
import com.aigreentick.services.marketing.client.dto.SendTemplateMessageResponse.WhatsAppMessageDto;
import com.aigreentick.services.marketing.client.service.WhatsappClientService;

import lombok.extern.slf4j.Slf4j;

/**
 * Simulates Cloud API responses without HTTP calls, for load testing dispatch cycles.
 */
@Slf4j
@Service
@Profile("mock")
public class WhatsappClientMockImpl implements WhatsappClientService {

    private static final AtomicLong messageCounter = new AtomicLong(0);

    private static final int MIN_DELAY_MS = 20;
    private static final int MAX_DELAY_MS = 80;
    private static final double FAILURE_RATE = 0.05;

    private static final String[] ERROR_MESSAGES = {
        "Rate limit exceeded",
        "Invalid phone number",
        "Template not found",
        "Service unavailable"
    };
    private static final int[] ERROR_CODES = { 429, 400, 404, 503 };

    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong failedCalls = new AtomicLong(0);

    @Override
    public ProviderResponse<SendTemplateMessageResponse> sendMessage(
            String bodyJson,
            String phoneNumberId,
            String accessToken) {

        long callNumber = totalCalls.incrementAndGet();
        ThreadLocalRandom random = ThreadLocalRandom.current();

        try {
            Thread.sleep(random.nextInt(MIN_DELAY_MS, MAX_DELAY_MS + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Mock call interrupted. callNumber={}", callNumber);
            return ProviderResponse.error("Request interrupted", 0);
        }

        if (random.nextDouble() < FAILURE_RATE) {
            failedCalls.incrementAndGet();
            int index = random.nextInt(ERROR_MESSAGES.length);
            return ProviderResponse.error(ERROR_MESSAGES[index], ERROR_CODES[index]);
        }

        SendTemplateMessageResponse response = new SendTemplateMessageResponse();
        response.setMessagingProduct("whatsapp");
        response.setContacts(List.of(new WhatsAppContactDto(phoneNumberId, phoneNumberId)));
        response.setMessages(List.of(new WhatsAppMessageDto(generateMessageId(), "accepted")));

        if (callNumber % 1000 == 0) {
            log.info("Mock WhatsApp client: calls={} failed={}", callNumber, failedCalls.get());
        }
        return ProviderResponse.success(response, 200);
    }

    /**
     * Format: wamid.{uuid}_{sequence}
     */
    private String generateMessageId() {
        String uuid = UUID.randomUUID().toString().replace("-", "");
        return String.format("wamid.%s_%d", uuid, messageCounter.incrementAndGet());
    }
}
