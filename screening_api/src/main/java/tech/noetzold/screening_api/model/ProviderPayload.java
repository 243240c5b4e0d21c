package tech.noetzold.screening_api.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw provider response, or the sentinel stored when the provider could not be reached.
 */
public record ProviderPayload(String providerId, JsonNode body, String failureReason) {

    public static ProviderPayload success(String providerId, JsonNode body) {
        return new ProviderPayload(providerId, body, null);
    }

    public static ProviderPayload failure(String providerId, String reason) {
        return new ProviderPayload(providerId, null, reason == null ? "unknown failure" : reason);
    }

    public boolean isFailure() {
        return failureReason != null || body == null;
    }
}
