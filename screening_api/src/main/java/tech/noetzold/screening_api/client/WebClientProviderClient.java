package tech.noetzold.screening_api.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.screening_api.model.ProviderPayload;

import java.time.Duration;
import java.util.function.Function;

/**
 * Shared request handling for HTTP providers: non-2xx answers, timeouts and transport errors all
 * come back as a failure payload instead of an exception.
 */
@Slf4j
public abstract class WebClientProviderClient implements ProviderClient {

    private final String providerId;
    protected final WebClient webClient;
    private final Duration timeout;

    protected WebClientProviderClient(String providerId, WebClient webClient, Duration timeout) {
        this.providerId = providerId;
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    protected ProviderPayload exchange(String subjectId, Function<WebClient, WebClient.RequestHeadersSpec<?>> request) {
        try {
            return request.apply(webClient)
                    .exchangeToMono(resp -> {
                        HttpStatusCode status = resp.statusCode();
                        if (status.is2xxSuccessful()) {
                            return resp.bodyToMono(JsonNode.class)
                                    .map(body -> accept(subjectId, body))
                                    .defaultIfEmpty(ProviderPayload.failure(providerId, "empty body"));
                        }
                        return resp.releaseBody()
                                .then(Mono.just(ProviderPayload.failure(providerId, "HTTP " + status.value())));
                    })
                    .timeout(timeout)
                    .onErrorResume(e -> {
                        log.warn("Provider {} call failed for subject {}: {}", providerId, subjectId, e.toString());
                        return Mono.just(ProviderPayload.failure(providerId, e.toString()));
                    })
                    .blockOptional()
                    .orElse(ProviderPayload.failure(providerId, "no response"));
        } catch (RuntimeException e) {
            log.warn("Provider {} call failed for subject {}", providerId, subjectId, e);
            return ProviderPayload.failure(providerId, e.toString());
        }
    }

    /** Hook for provider-level success flags; the default accepts any body. */
    protected ProviderPayload accept(String subjectId, JsonNode body) {
        return ProviderPayload.success(providerId, body);
    }
}
