package tech.noetzold.screening_api.model;

import java.util.List;
import java.util.Map;

/** One signal type inside a high/medium/none/undetermined bucket of an entity verdict. */
public record SignalBucket(
        String riskType,
        RiskLevel riskLevel,
        String riskDescription,
        String info,
        String riskDescriptionInfo,
        List<Map<String, Object>> detailRows
) {

    public SignalBucket {
        detailRows = detailRows == null ? List.of() : List.copyOf(detailRows);
    }
}
