package tech.noetzold.screening_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Evaluation window of a screening. The end date doubles as the evaluation date for every
 * time-relative rule, so results never depend on the wall clock.
 */
public record ScreeningWindow(
        @JsonProperty("start_date") LocalDate start,
        @JsonProperty("end_date") LocalDate end
) {

    public ScreeningWindow {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    public static ScreeningWindow endingAt(LocalDate end, int days) {
        return new ScreeningWindow(end.minusDays(days), end);
    }

    public LocalDate evaluationDate() {
        return end;
    }

    /** Lloyd's voyageDateRange format, e.g. {@code 2024-08-25-2025-08-25}. */
    public String asDateRange() {
        return start + "-" + end;
    }
}
