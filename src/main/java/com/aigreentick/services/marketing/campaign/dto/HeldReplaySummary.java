package com.aigreentick.services.marketing.campaign.dto;

public record HeldReplaySummary(int applied, int dropped, int stillHeld) {
}
