package tech.noetzold.screening_api.model;

/**
 * Signal families the entity resolver buckets. SAN, OOL and SCO arrive classified by ingestion;
 * ONE_YEAR and SANCTIONED_COUNTRY are derived from the rows during resolution.
 */
public enum SignalType {

    SAN("is_san", false),
    OOL("is_ool", false),
    SCO("is_sco", false),
    ONE_YEAR("is_one_year", true),
    SANCTIONED_COUNTRY("is_sanctioned_countries", true);

    private final String riskType;
    private final boolean derived;

    SignalType(String riskType, boolean derived) {
        this.riskType = riskType;
        this.derived = derived;
    }

    /** Key used by the description table. */
    public String riskType() {
        return riskType;
    }

    public boolean isDerived() {
        return derived;
    }
}
