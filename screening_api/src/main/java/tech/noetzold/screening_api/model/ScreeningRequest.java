package tech.noetzold.screening_api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScreeningRequest(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("end_date") LocalDate endDate,
        @NotEmpty @Valid List<Party> parties
) {

    /** One role in the transaction, e.g. vessel, charterer or cargo origin. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Party(
            @NotBlank String role,
            @NotBlank @JsonProperty("subject_id") String subjectId,
            @NotEmpty List<@NotBlank String> checks,
            Map<String, Object> params
    ) {
    }
}
