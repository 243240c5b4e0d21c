package tech.noetzold.screening_api.orchestrator;

import tech.noetzold.screening_api.model.DescriptionText;
import tech.noetzold.screening_api.model.RiskLevel;

/**
 * Presentation text for a (risk type, level) pair. A miss returns {@link DescriptionText#EMPTY}.
 */
@FunctionalInterface
public interface DescriptionLookup {

    DescriptionText lookup(String riskType, RiskLevel level);

    static DescriptionLookup none() {
        return (riskType, level) -> DescriptionText.EMPTY;
    }
}
