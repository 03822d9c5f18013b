package com.aigreentick.services.marketing.campaign.dto.build;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cloud API template message body for one recipient.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildTemplate {

    @Builder.Default
    @JsonProperty("messaging_product")
    private String messagingProduct = "whatsapp";

    @Builder.Default
    @JsonProperty("recipient_type")
    private String recipientType = "individual";

    @NotNull
    private String to;

    @Builder.Default
    private String type = "template";

    private SendableTemplate template;
}
