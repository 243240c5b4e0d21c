package tech.noetzold.screening_api.probe;

import tech.noetzold.screening_api.model.RiskLevel;

import java.util.List;
import java.util.Set;

/**
 * A registered screening check. Leaf probes read one provider, aggregate probes read the records
 * of other probes.
 */
public interface Probe {

    String id();

    /** Human readable label carried as {@code riskDescription} on every record. */
    String description();

    String businessModule();

    List<String> requiredParameters();

    /** Levels this probe is allowed to produce. */
    Set<RiskLevel> riskLevels();
}
