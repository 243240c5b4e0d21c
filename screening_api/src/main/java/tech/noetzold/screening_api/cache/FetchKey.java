package tech.noetzold.screening_api.cache;

import tech.noetzold.screening_api.model.ScreeningWindow;

import java.time.LocalDate;

public record FetchKey(String providerId, String subjectId, LocalDate windowStart, LocalDate windowEnd) {

    public static FetchKey of(String providerId, String subjectId, ScreeningWindow window) {
        return new FetchKey(providerId, subjectId,
                window == null ? null : window.start(),
                window == null ? null : window.end());
    }
}
