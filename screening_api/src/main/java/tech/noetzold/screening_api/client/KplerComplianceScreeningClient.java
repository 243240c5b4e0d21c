package tech.noetzold.screening_api.client;

import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.ScreeningWindow;

import java.time.Duration;

public class KplerComplianceScreeningClient extends WebClientProviderClient {

    public static final String PROVIDER_ID = "kpler_compliance_screening";

    public KplerComplianceScreeningClient(WebClient webClient, Duration timeout) {
        super(PROVIDER_ID, webClient, timeout);
    }

    @Override
    public ProviderPayload fetch(String subjectId, ScreeningWindow window) {
        return exchange(subjectId, client -> client.get()
                .uri(uri -> uri.path("/compliance/compliance-screening").queryParam("vessels", subjectId).build()));
    }
}
