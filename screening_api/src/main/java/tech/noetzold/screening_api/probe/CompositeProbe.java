package tech.noetzold.screening_api.probe;

import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.model.RiskRecord;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate probe whose level is the fold-merge of its components. Rows are concatenated in
 * component order, each tagged with {@value #SOURCE} naming the component it came from. Leaf rows
 * never carry that key (provider fields of the same name are kept as
 * {@value PayloadReader#PROVIDER_SOURCE}), so a tag already present was set by a nested aggregate
 * and the innermost one is kept.
 */
public class CompositeProbe implements AggregateProbe {

    public static final String SOURCE = "source";

    private final String id;
    private final String description;
    private final String businessModule;
    private final List<String> componentProbeIds;
    private final List<String> requiredParameters;

    public CompositeProbe(String id, String description, String businessModule,
                          List<String> componentProbeIds, List<String> requiredParameters) {
        if (componentProbeIds == null || componentProbeIds.isEmpty()) {
            throw new IllegalArgumentException("Aggregate probe " + id + " needs at least one component");
        }
        this.id = id;
        this.description = description;
        this.businessModule = businessModule;
        this.componentProbeIds = List.copyOf(componentProbeIds);
        this.requiredParameters = List.copyOf(requiredParameters);
    }

    @Override
    public RiskRecord combine(List<RiskRecord> records) {
        if (records.size() != componentProbeIds.size()) {
            throw new IllegalArgumentException("Aggregate probe " + id + " expects " + componentProbeIds.size()
                    + " component records, got " + records.size());
        }

        RiskLevel level = RiskLevel.UNDETERMINED;
        List<Map<String, Object>> rows = new ArrayList<>();
        Map<String, String> subjectRef = new LinkedHashMap<>();

        for (int i = 0; i < records.size(); i++) {
            RiskRecord component = records.get(i);
            level = RiskLevel.merge(level, component.riskLevel());
            for (Map<String, Object> row : component.detailRows()) {
                Map<String, Object> tagged = new LinkedHashMap<>(row);
                tagged.putIfAbsent(SOURCE, componentProbeIds.get(i));
                rows.add(tagged);
            }
            component.subjectRef().forEach(subjectRef::putIfAbsent);
        }

        if (!level.isDeterminate()) {
            level = RiskLevel.NO_DATA;
        }
        return RiskRecord.of(id, description, level, rows, subjectRef);
    }

    @Override
    public List<String> componentProbeIds() {
        return componentProbeIds;
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
    public List<String> requiredParameters() {
        return requiredParameters;
    }

    @Override
    public Set<RiskLevel> riskLevels() {
        return Set.copyOf(EnumSet.complementOf(EnumSet.of(RiskLevel.UNDETERMINED)));
    }
}
