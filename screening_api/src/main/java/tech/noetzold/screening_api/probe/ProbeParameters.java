package tech.noetzold.screening_api.probe;

import tech.noetzold.screening_api.exception.ParameterValidationException;
import tech.noetzold.screening_api.model.ScreeningWindow;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ProbeParameters {

    public static final String VESSEL_IMO = "vessel_imo";
    public static final String COUNTRY_NAME = "country_name";
    public static final String START_DATE = "start_date";
    public static final String END_DATE = "end_date";
    public static final String EVALUATION_DATE = "evaluation_date";

    private ProbeParameters() {
    }

    public static Map<String, Object> withSubject(Map<String, Object> params, String subjectParameter, String subjectId) {
        Map<String, Object> effective = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        if (subjectId != null && !subjectId.isBlank() && isBlank(effective.get(subjectParameter))) {
            effective.put(subjectParameter, subjectId);
        }
        return effective;
    }

    public static List<String> invalid(List<String> required, Map<String, Object> params) {
        List<String> invalid = new ArrayList<>();
        for (String name : required) {
            Object value = params.get(name);
            if (isBlank(value) || !wellFormed(name, value.toString().trim())) {
                invalid.add(name);
            }
        }
        return invalid;
    }

    public static void validate(String probeId, List<String> required, Map<String, Object> params) {
        List<String> invalid = invalid(required, params);
        if (!invalid.isEmpty()) {
            throw new ParameterValidationException(probeId, invalid);
        }
    }

    /** Explicit {@code evaluation_date}, else the window end. */
    public static Optional<LocalDate> evaluationDate(Map<String, Object> params) {
        Optional<LocalDate> explicit = isoDate(params.get(EVALUATION_DATE));
        return explicit.isPresent() ? explicit : isoDate(params.get(END_DATE));
    }

    public static Optional<ScreeningWindow> window(Map<String, Object> params) {
        Optional<LocalDate> start = isoDate(params.get(START_DATE));
        Optional<LocalDate> end = isoDate(params.get(END_DATE));
        if (start.isEmpty() || end.isEmpty() || start.get().isAfter(end.get())) {
            return Optional.empty();
        }
        return Optional.of(new ScreeningWindow(start.get(), end.get()));
    }

    public static String text(Map<String, Object> params, String name) {
        Object value = params.get(name);
        return value == null ? null : value.toString().trim();
    }

    private static boolean wellFormed(String name, String value) {
        if (name.endsWith("_date")) {
            return isoDate(value).isPresent();
        }
        if (VESSEL_IMO.equals(name)) {
            return value.chars().allMatch(Character::isDigit);
        }
        return true;
    }

    private static Optional<LocalDate> isoDate(Object value) {
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (isBlank(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.toString().trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
