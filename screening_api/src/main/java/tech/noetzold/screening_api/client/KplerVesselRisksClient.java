package tech.noetzold.screening_api.client;

import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.screening_api.exception.ProviderException;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.ScreeningWindow;

import java.time.Duration;
import java.util.List;

public class KplerVesselRisksClient extends WebClientProviderClient {

    public static final String PROVIDER_ID = "kpler_vessel_risks";

    public KplerVesselRisksClient(WebClient webClient, Duration timeout) {
        super(PROVIDER_ID, webClient, timeout);
    }

    @Override
    public ProviderPayload fetch(String subjectId, ScreeningWindow window) {
        long imo;
        try {
            imo = Long.parseLong(subjectId.trim());
        } catch (NumberFormatException e) {
            throw new ProviderException(PROVIDER_ID, subjectId, "Kpler expects a numeric IMO", e);
        }
        return exchange(subjectId, client -> client.post()
                .uri(uri -> {
                    uri.path("/compliance/vessel-risks-v2");
                    if (window != null) {
                        uri.queryParam("startDate", window.start()).queryParam("endDate", window.end());
                    }
                    return uri.build();
                })
                .bodyValue(List.of(imo)));
    }
}
