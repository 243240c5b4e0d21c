package tech.noetzold.screening_api.client;

import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.ScreeningWindow;

/**
 * One external data source. Implementations may throw {@link tech.noetzold.screening_api.exception.ProviderException}
 * or return {@link ProviderPayload#failure}; both end up as a cached failure sentinel.
 */
public interface ProviderClient {

    String providerId();

    ProviderPayload fetch(String subjectId, ScreeningWindow window);
}
