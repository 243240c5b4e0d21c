package tech.noetzold.screening_api.probe;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import tech.noetzold.screening_api.exception.ParameterValidationException;
import tech.noetzold.screening_api.exception.ProviderException;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.model.RiskRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Common flow of a leaf probe: fill the subject parameter, validate, reject failed payloads, then
 * hand the provider body to {@link #classify}. Validation and provider problems become NO_DATA
 * records here, so subclasses only deal with a well formed payload.
 */
@Slf4j
public abstract class AbstractProviderProbe implements LeafProbe {

    private final String id;
    private final String description;
    private final String businessModule;
    private final String providerId;
    private final String subjectParameter;
    private final List<String> requiredParameters;
    private final Set<RiskLevel> riskLevels;

    protected AbstractProviderProbe(String id, String description, String businessModule, String providerId,
                                    String subjectParameter, List<String> requiredParameters,
                                    Collection<RiskLevel> producedLevels) {
        this.id = id;
        this.description = description;
        this.businessModule = businessModule;
        this.providerId = providerId;
        this.subjectParameter = subjectParameter;
        this.requiredParameters = List.copyOf(requiredParameters);
        Set<RiskLevel> levels = EnumSet.of(RiskLevel.NO_DATA, RiskLevel.NO_RISK);
        levels.addAll(producedLevels);
        this.riskLevels = Set.copyOf(levels);
    }

    /** Level and detail rows extracted from a successful provider body. */
    public record Classification(RiskLevel level, List<Map<String, Object>> rows) {

        public static Classification noRisk() {
            return new Classification(RiskLevel.NO_RISK, List.of());
        }
    }

    protected abstract Classification classify(String subjectId, Map<String, Object> params, JsonNode body);

    @Override
    public final RiskRecord evaluate(String subjectId, Map<String, Object> params, ProviderPayload providerData) {
        Map<String, Object> effective = ProbeParameters.withSubject(params, subjectParameter, subjectId);
        String subject = bestEffortSubject(subjectId, effective);
        Map<String, String> subjectRef = Map.of(subjectParameter, subject);

        try {
            ProbeParameters.validate(id, requiredParameters, effective);
        } catch (ParameterValidationException e) {
            log.warn("Probe {} skipped for subject {}: {}", id, subject, e.getMessage());
            return RiskRecord.noData(id, description, subjectRef);
        }

        if (providerData == null || providerData.isFailure()) {
            log.warn("Provider {} unavailable for probe {} subject {}: {}", providerId, id, subject,
                    providerData == null ? "no payload" : providerData.failureReason());
            return RiskRecord.noData(id, description, subjectRef);
        }

        try {
            Classification result = classify(subject, effective, providerData.body());
            List<Map<String, Object>> rows = result.rows().stream().map(PayloadReader::providerRow).toList();
            return RiskRecord.of(id, description, result.level(), rows, subjectRef);
        } catch (ProviderException e) {
            log.warn("Provider {} returned an unexpected payload for probe {} subject {}", providerId, id, subject, e);
            return RiskRecord.noData(id, description, subjectRef);
        }
    }

    private String bestEffortSubject(String subjectId, Map<String, Object> params) {
        if (subjectId != null && !subjectId.isBlank()) {
            return subjectId.trim();
        }
        String fromParams = ProbeParameters.text(params, subjectParameter);
        return fromParams == null ? "" : fromParams;
    }

    /**
     * Current vs historical listing: any entry without an end date is a current sanction (HIGH),
     * entries that all carry an end date are historical (MEDIUM), no entry at all is NO_RISK.
     */
    protected static RiskLevel currentOrHistorical(List<JsonNode> entries, String endDateField) {
        if (entries.isEmpty()) {
            return RiskLevel.NO_RISK;
        }
        for (JsonNode entry : entries) {
            if (PayloadReader.isBlankText(entry, endDateField)) {
                return RiskLevel.HIGH;
            }
        }
        return RiskLevel.MEDIUM;
    }

    protected static List<Map<String, Object>> rows(Iterable<JsonNode> nodes) {
        List<Map<String, Object>> rows = new ArrayList<>();
        nodes.forEach(node -> rows.add(PayloadReader.fullRow(node)));
        return rows;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public String businessModule() {
        return businessModule;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public String subjectParameter() {
        return subjectParameter;
    }

    @Override
    public List<String> requiredParameters() {
        return requiredParameters;
    }

    @Override
    public Set<RiskLevel> riskLevels() {
        return riskLevels;
    }
}
