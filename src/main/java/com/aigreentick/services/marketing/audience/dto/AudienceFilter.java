package com.aigreentick.services.marketing.audience.dto;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Target audience criteria sent to the profile service. Null fields do not filter.
 * Only subscribed profiles are ever returned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AudienceFilter {

    public static final String SUBSCRIBED = "subscribed";

    /** Customer tier, or "all". */
    @JsonProperty("customer_tier")
    private String customerTier;

    private String city;

    private String state;

    /** Profile must carry every listed tag. */
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private String subscription = SUBSCRIBED;

    public static AudienceFilter everyone() {
        return AudienceFilter.builder().build();
    }

    /**
     * Problems with this filter, empty when it is acceptable.
     */
    public List<String> validate() {
        List<String> violations = new ArrayList<>();
        if (subscription != null && !SUBSCRIBED.equals(subscription)) {
            violations.add("subscription filter must be '" + SUBSCRIBED + "'");
        }
        if (tags != null && tags.stream().anyMatch(tag -> tag == null || tag.isBlank())) {
            violations.add("tags must not contain blank values");
        }
        return violations;
    }
}
