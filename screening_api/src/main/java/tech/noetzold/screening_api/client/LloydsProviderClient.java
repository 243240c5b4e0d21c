package tech.noetzold.screening_api.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.ScreeningWindow;

import java.time.Duration;

/**
 * One Lloyd's List Intelligence endpoint queried by vessel IMO, optionally with a voyage date range.
 * Responses with {@code IsSuccess=false} are treated as failures.
 */
public class LloydsProviderClient extends WebClientProviderClient {

    public static final String SANCTIONS = "lloyds_sanctions";
    public static final String RISK_SCORE = "lloyds_risk_score";
    public static final String COMPLIANCE_RISK = "lloyds_compliance_risk";
    public static final String VOYAGE_EVENTS = "lloyds_voyage_events";

    private final String path;
    private final boolean windowed;

    public LloydsProviderClient(String providerId, WebClient webClient, Duration timeout, String path, boolean windowed) {
        super(providerId, webClient, timeout);
        this.path = path;
        this.windowed = windowed;
    }

    @Override
    public ProviderPayload fetch(String subjectId, ScreeningWindow window) {
        return exchange(subjectId, client -> client.get()
                .uri(uri -> {
                    uri.path(path).queryParam("vesselImo", subjectId);
                    if (windowed && window != null) {
                        uri.queryParam("voyageDateRange", window.asDateRange());
                    }
                    return uri.build();
                }));
    }

    @Override
    protected ProviderPayload accept(String subjectId, JsonNode body) {
        JsonNode success = body.get("IsSuccess");
        if (success != null && !success.asBoolean()) {
            return ProviderPayload.failure(providerId(), "IsSuccess=false for vessel " + subjectId);
        }
        return ProviderPayload.success(providerId(), body);
    }
}
