package tech.noetzold.screening_api.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.ScreeningWindow;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LloydsProviderClientTest {

    private static final String IMO = "9876543";
    private static final ScreeningWindow WINDOW = new ScreeningWindow(LocalDate.of(2024, 8, 25), LocalDate.of(2025, 8, 25));

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WebClient webClient(HttpStatus status, String body) {
        return WebClient.builder()
                .baseUrl("https://lloyds.test/v1")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }

    private LloydsProviderClient client(WebClient webClient, boolean windowed) {
        return new LloydsProviderClient(LloydsProviderClient.VOYAGE_EVENTS, webClient, Duration.ofSeconds(2),
                "/vesselvoyageevents", windowed);
    }

    @Test
    @DisplayName("a successful answer is returned as the payload body")
    void success() {
        ProviderPayload payload = client(webClient(HttpStatus.OK, "{\"IsSuccess\":true,\"Data\":{\"Items\":[]}}"), true)
                .fetch(IMO, WINDOW);

        assertThat(payload.isFailure()).isFalse();
        assertThat(payload.providerId()).isEqualTo(LloydsProviderClient.VOYAGE_EVENTS);
        assertThat(payload.body().path("Data").has("Items")).isTrue();
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.GET);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/v1/vesselvoyageevents");
        assertThat(lastRequest.get().url().getQuery())
                .contains("vesselImo=9876543")
                .contains("voyageDateRange=2024-08-25-2025-08-25");
    }

    @Test
    @DisplayName("endpoints without a date range only send the IMO")
    void notWindowed() {
        client(webClient(HttpStatus.OK, "{\"IsSuccess\":true,\"Data\":{}}"), false).fetch(IMO, WINDOW);

        assertThat(lastRequest.get().url().getQuery()).isEqualTo("vesselImo=9876543");
    }

    @Test
    @DisplayName("IsSuccess=false is a failure")
    void unsuccessfulAnswer() {
        ProviderPayload payload = client(webClient(HttpStatus.OK, "{\"IsSuccess\":false,\"Errors\":[\"quota\"]}"), true)
                .fetch(IMO, WINDOW);

        assertThat(payload.isFailure()).isTrue();
        assertThat(payload.failureReason()).contains("IsSuccess=false");
    }

    @Test
    @DisplayName("a non-2xx status is a failure")
    void serverError() {
        ProviderPayload payload = client(webClient(HttpStatus.SERVICE_UNAVAILABLE, "{}"), true).fetch(IMO, WINDOW);

        assertThat(payload.isFailure()).isTrue();
        assertThat(payload.failureReason()).isEqualTo("HTTP 503");
    }

    @Test
    @DisplayName("a transport error is a failure, not an exception")
    void transportError() {
        WebClient failing = WebClient.builder()
                .exchangeFunction(request -> Mono.error(new IOException("connection refused")))
                .build();

        ProviderPayload payload = client(failing, true).fetch(IMO, WINDOW);

        assertThat(payload.isFailure()).isTrue();
        assertThat(payload.failureReason()).contains("connection refused");
    }

    @Test
    @DisplayName("a slow provider is cut off at the timeout")
    void slowProvider() {
        WebClient slow = WebClient.builder()
                .exchangeFunction(request -> Mono.<ClientResponse>never())
                .build();
        LloydsProviderClient client = new LloydsProviderClient(LloydsProviderClient.SANCTIONS, slow, Duration.ofMillis(100),
                "/vesselsanctions_v2", false);

        assertThat(client.fetch(IMO, null).isFailure()).isTrue();
    }

    @Test
    @DisplayName("Kpler rejects a non-numeric IMO before calling out")
    void kplerNonNumericImo() {
        KplerVesselRisksClient kpler = new KplerVesselRisksClient(webClient(HttpStatus.OK, "[]"), Duration.ofSeconds(2));

        assertThatThrownBy(() -> kpler.fetch("IMO-98", WINDOW))
                .isInstanceOf(tech.noetzold.screening_api.exception.ProviderException.class);
        assertThat(lastRequest.get()).isNull();
    }

    @Test
    @DisplayName("Kpler vessel risks are requested by POST with the window as query parameters")
    void kplerRequest() {
        KplerVesselRisksClient kpler = new KplerVesselRisksClient(webClient(HttpStatus.OK, "[]"), Duration.ofSeconds(2));

        ProviderPayload payload = kpler.fetch(IMO, WINDOW);

        assertThat(payload.isFailure()).isFalse();
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().getPath()).endsWith("/compliance/vessel-risks-v2");
        assertThat(lastRequest.get().url().getQuery()).contains("startDate=2024-08-25").contains("endDate=2025-08-25");
    }
}
