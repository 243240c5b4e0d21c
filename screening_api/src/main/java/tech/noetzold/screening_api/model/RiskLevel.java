package tech.noetzold.screening_api.model;

import java.util.Collection;
import java.util.Comparator;

/**
 * Severity of a screening signal.
 *
 * <p>The determinate levels are totally ordered {@code NO_DATA < NO_RISK < LOW < MEDIUM < HIGH}.
 * {@link #UNDETERMINED} sits outside that order: it marks a signal whose inputs were absent and is
 * absorbed by any determinate level when merged.
 */
public enum RiskLevel {

    NO_DATA(0),
    NO_RISK(1),
    LOW(2),
    MEDIUM(3),
    HIGH(4),
    UNDETERMINED(-1);

    /** Orders determinate levels by severity; UNDETERMINED sorts below everything. */
    public static final Comparator<RiskLevel> SEVERITY = Comparator.comparingInt(level -> level.rank);

    private final int rank;

    RiskLevel(int rank) {
        this.rank = rank;
    }

    public boolean isDeterminate() {
        return this != UNDETERMINED;
    }

    public static int compare(RiskLevel a, RiskLevel b) {
        return SEVERITY.compare(a, b);
    }

    public static RiskLevel merge(RiskLevel a, RiskLevel b) {
        if (!a.isDeterminate()) {
            return b;
        }
        if (!b.isDeterminate()) {
            return a;
        }
        return a.rank >= b.rank ? a : b;
    }

    /** Fold-merge; an empty input yields UNDETERMINED. */
    public static RiskLevel mergeAll(Collection<RiskLevel> levels) {
        RiskLevel result = UNDETERMINED;
        for (RiskLevel level : levels) {
            result = merge(result, level);
        }
        return result;
    }

    public boolean atLeast(RiskLevel other) {
        return isDeterminate() && other.isDeterminate() && rank >= other.rank;
    }
}
