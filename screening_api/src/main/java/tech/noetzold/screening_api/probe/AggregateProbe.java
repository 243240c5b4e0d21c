package tech.noetzold.screening_api.probe;

import tech.noetzold.screening_api.model.RiskRecord;

import java.util.List;

public interface AggregateProbe extends Probe {

    List<String> componentProbeIds();

    /**
     * Combines the component records, given in {@link #componentProbeIds()} order.
     */
    RiskRecord combine(List<RiskRecord> records);
}
