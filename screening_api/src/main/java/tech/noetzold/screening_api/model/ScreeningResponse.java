package tech.noetzold.screening_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ScreeningResponse(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("window") ScreeningWindow window,
        @JsonProperty("parties") List<PartyResult> parties,
        @JsonProperty("transaction") RiskRecord transaction,
        @JsonProperty("summary") ScreeningSummary summary
) {

    public record PartyResult(
            @JsonProperty("role") String role,
            @JsonProperty("subject_id") String subjectId,
            @JsonProperty("results") List<RiskRecord> results
    ) {
    }
}
