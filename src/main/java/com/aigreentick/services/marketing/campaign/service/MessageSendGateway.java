package com.aigreentick.services.marketing.campaign.service;

import com.aigreentick.services.marketing.campaign.dto.OutboundMessage;
import com.aigreentick.services.marketing.exception.GatewaySendException;

/**
 * Outbound send call to the messaging provider.
 */
public interface MessageSendGateway {

    /**
     * Sends one templated message.
     *
     * @return the provider message id used to correlate later status events
     * @throws GatewaySendException when the provider rejects the message or cannot be reached
     */
    String send(OutboundMessage message);
}
