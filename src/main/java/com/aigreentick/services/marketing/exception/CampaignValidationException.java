package com.aigreentick.services.marketing.exception;

import java.util.List;

public class CampaignValidationException extends CampaignException {

    private final List<String> violations;

    public CampaignValidationException(List<String> violations) {
        super("Invalid campaign: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public CampaignValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
