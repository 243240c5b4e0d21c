package tech.noetzold.screening_api.model;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only snapshot of the risk description table, keyed by risk type and level.
 */
public final class DescriptionTable {

    private record Key(String riskType, RiskLevel level) {
    }

    private record Entry(String label, DescriptionText text) {
    }

    private static final DescriptionTable EMPTY = new DescriptionTable(Map.of());

    private final Map<Key, Entry> entries;

    private DescriptionTable(Map<Key, Entry> entries) {
        this.entries = entries;
    }

    public static DescriptionTable empty() {
        return EMPTY;
    }

    public static DescriptionTable of(Collection<RiskDescription> rows) {
        Map<Key, Entry> entries = new HashMap<>();
        for (RiskDescription row : rows) {
            if (row.getRiskType() == null || row.getRiskLevel() == null) {
                continue;
            }
            entries.put(new Key(row.getRiskType(), row.getRiskLevel()),
                    new Entry(row.getRiskDesc() == null ? "" : row.getRiskDesc(),
                            new DescriptionText(row.getInfo(), row.getRiskDescInfo())));
        }
        return new DescriptionTable(Map.copyOf(entries));
    }

    public DescriptionText text(String riskType, RiskLevel level) {
        Entry entry = entries.get(new Key(riskType, level));
        return entry == null ? DescriptionText.EMPTY : entry.text();
    }

    public String label(String riskType, RiskLevel level) {
        Entry entry = entries.get(new Key(riskType, level));
        return entry == null ? "" : entry.label();
    }

    public int size() {
        return entries.size();
    }
}
