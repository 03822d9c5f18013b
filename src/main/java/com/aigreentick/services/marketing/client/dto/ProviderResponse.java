package com.aigreentick.services.marketing.client.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one provider HTTP call: either a parsed body or an error message with the HTTP status.
 * A status code of 0 means no HTTP response was received.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProviderResponse<T> {

    private boolean success;
    private T data;
    private String errorMessage;
    private int statusCode;

    public static <T> ProviderResponse<T> success(T data, int statusCode) {
        return new ProviderResponse<>(true, data, null, statusCode);
    }

    public static <T> ProviderResponse<T> error(String errorMessage, int statusCode) {
        return new ProviderResponse<>(false, null, errorMessage, statusCode);
    }
}
