package tech.noetzold.screening_api.probe.kpler;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.probe.PayloadReader;

import java.util.List;

/** Locates the subject's record in a Kpler vessel-risks response. */
final class KplerRecords {

    private KplerRecords() {
    }

    static JsonNode findVessel(String providerId, JsonNode body, String imo) {
        for (JsonNode record : PayloadReader.requireArray(providerId, body)) {
            String recordImo = PayloadReader.text(record, "vessel", "imo");
            if (recordImo != null && recordImo.trim().equals(imo)) {
                return record;
            }
        }
        return null;
    }

    static List<JsonNode> riskList(JsonNode record, String group, String list) {
        return PayloadReader.elements(record, "compliance", group, list);
    }
}
