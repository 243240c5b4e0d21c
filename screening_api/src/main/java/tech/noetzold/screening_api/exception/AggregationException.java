package tech.noetzold.screening_api.exception;

/**
 * A component of an aggregate probe failed with an unexpected fault. The aggregate treats the
 * component as NO_DATA.
 */
public class AggregationException extends ScreeningException {

    private final String aggregateId;
    private final String componentId;

    public AggregationException(String aggregateId, String componentId, Throwable cause) {
        super("aggregation_error", "Component " + componentId + " of " + aggregateId + " failed", cause);
        this.aggregateId = aggregateId;
        this.componentId = componentId;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getComponentId() {
        return componentId;
    }
}
