package tech.noetzold.screening_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AssociatedParty(
        @JsonProperty("sorp_id") String sorpId,
        @JsonProperty("nmtoken_level") String level,
        @JsonProperty("related_name") String relatedName,
        @JsonProperty("source_type") String sourceType,
        @JsonProperty("relation_name") String relationName
) {
}
