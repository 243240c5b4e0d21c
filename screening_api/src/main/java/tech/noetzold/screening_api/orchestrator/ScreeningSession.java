package tech.noetzold.screening_api.orchestrator;

import lombok.extern.slf4j.Slf4j;
import tech.noetzold.screening_api.cache.FetchCache;
import tech.noetzold.screening_api.client.ProviderClient;
import tech.noetzold.screening_api.exception.AggregationException;
import tech.noetzold.screening_api.exception.ConfigurationException;
import tech.noetzold.screening_api.model.DescriptionText;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.RiskRecord;
import tech.noetzold.screening_api.model.ScreeningWindow;
import tech.noetzold.screening_api.probe.AggregateProbe;
import tech.noetzold.screening_api.probe.LeafProbe;
import tech.noetzold.screening_api.probe.Probe;
import tech.noetzold.screening_api.probe.ProbeParameters;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * One screening session. Owns the fetch cache, so every provider is called at most once per
 * subject and window for as long as the session lives.
 */
@Slf4j
public class ScreeningSession implements AutoCloseable {

    private final ScreeningOrchestrator orchestrator;
    private final FetchCache cache;

    ScreeningSession(ScreeningOrchestrator orchestrator, FetchCache cache) {
        this.orchestrator = orchestrator;
        this.cache = cache;
    }

    public List<RiskRecord> execute(List<String> checkIds, String subjectId, Map<String, Object> params) {
        return executeAsync(checkIds, subjectId, params).join();
    }

    /**
     * Returns one record per requested check, in request order. Unknown check ids fail immediately
     * with a {@link ConfigurationException}; any other failure degrades that check to NO_DATA.
     * Cancelling the returned future does not cancel provider calls already started.
     */
    public CompletableFuture<List<RiskRecord>> executeAsync(List<String> checkIds, String subjectId,
                                                            Map<String, Object> params) {
        Map<String, Probe> plan = orchestrator.registry().resolve(checkIds);
        Map<String, Object> effective = params == null ? Map.of() : Map.copyOf(withoutNulls(params));
        ScreeningWindow window = ProbeParameters.window(effective).orElse(null);

        Map<String, CompletableFuture<RiskRecord>> evaluations = new HashMap<>();
        List<CompletableFuture<RiskRecord>> requested = new ArrayList<>();
        for (String checkId : checkIds) {
            CompletableFuture<RiskRecord> record = evaluate(checkId, plan, evaluations, subjectId, effective, window)
                    .handle((result, error) -> error == null
                            ? result
                            : degraded(plan, checkId, subjectId, error))
                    .thenApply(this::decorate);
            requested.add(record);
        }

        return CompletableFuture.allOf(requested.toArray(new CompletableFuture[0]))
                .thenApply(done -> requested.stream().map(CompletableFuture::join).toList());
    }

    public FetchCache cache() {
        return cache;
    }

    @Override
    public void close() {
        log.debug("Screening session closed: {} provider calls, {} cache hits", cache.misses(), cache.hits());
    }

    private CompletableFuture<RiskRecord> evaluate(String probeId, Map<String, Probe> plan,
                                                   Map<String, CompletableFuture<RiskRecord>> evaluations,
                                                   String subjectId, Map<String, Object> params, ScreeningWindow window) {
        CompletableFuture<RiskRecord> existing = evaluations.get(probeId);
        if (existing != null) {
            return existing;
        }

        Probe probe = plan.get(probeId);
        CompletableFuture<RiskRecord> result;
        if (probe instanceof AggregateProbe aggregate) {
            List<CompletableFuture<RiskRecord>> components = new ArrayList<>();
            for (String componentId : aggregate.componentProbeIds()) {
                components.add(evaluate(componentId, plan, evaluations, subjectId, params, window)
                        .handle((record, error) -> error == null
                                ? record
                                : componentFailed(plan, aggregate, componentId, subjectId, error)));
            }
            result = CompletableFuture.allOf(components.toArray(new CompletableFuture[0]))
                    .thenApply(done -> aggregate.combine(components.stream().map(CompletableFuture::join).toList()));
        } else if (probe instanceof LeafProbe leaf) {
            result = fetch(leaf, subjectId, params, window)
                    .thenApplyAsync(payload -> leaf.evaluate(subjectId, params, payload), orchestrator.executor());
        } else {
            throw new ConfigurationException("Unsupported probe type for " + probeId, probeId);
        }

        evaluations.put(probeId, result);
        return result;
    }

    private CompletableFuture<ProviderPayload> fetch(LeafProbe leaf, String subjectId, Map<String, Object> params,
                                                     ScreeningWindow window) {
        Map<String, Object> withSubject = ProbeParameters.withSubject(params, leaf.subjectParameter(), subjectId);
        if (!ProbeParameters.invalid(leaf.requiredParameters(), withSubject).isEmpty()) {
            // the probe reports the invalid parameters itself
            return CompletableFuture.completedFuture(null);
        }

        String subject = ProbeParameters.text(withSubject, leaf.subjectParameter());
        ProviderClient client = orchestrator.client(leaf.providerId());
        long timeoutMs = orchestrator.providerTimeout().toMillis();
        return cache.getOrFetchAsync(leaf.providerId(), subject, window,
                () -> CompletableFuture.supplyAsync(() -> client.fetch(subject, window), orchestrator.executor())
                        .orTimeout(timeoutMs, TimeUnit.MILLISECONDS));
    }

    private RiskRecord componentFailed(Map<String, Probe> plan, AggregateProbe aggregate, String componentId,
                                       String subjectId, Throwable error) {
        AggregationException failure = new AggregationException(aggregate.id(), componentId, unwrap(error));
        log.warn("{}, treating it as NO_DATA for subject {}", failure.getMessage(), subjectId, failure);
        Probe component = plan.get(componentId);
        return RiskRecord.noData(componentId, component.description(), subjectRef(plan, component, subjectId));
    }

    private RiskRecord degraded(Map<String, Probe> plan, String checkId, String subjectId, Throwable error) {
        log.warn("Check {} failed for subject {}, returning NO_DATA", checkId, subjectId, unwrap(error));
        Probe probe = plan.get(checkId);
        return RiskRecord.noData(checkId, probe.description(), subjectRef(plan, probe, subjectId));
    }

    private RiskRecord decorate(RiskRecord record) {
        DescriptionText text;
        try {
            text = orchestrator.descriptions().lookup(record.riskType(), record.riskLevel());
        } catch (RuntimeException e) {
            log.warn("Description lookup failed for {} / {}", record.riskType(), record.riskLevel(), e);
            text = DescriptionText.EMPTY;
        }
        if (text == null) {
            text = DescriptionText.EMPTY;
        }
        return record.withDescriptions(text.info(), text.riskDescriptionInfo());
    }

    private static Map<String, String> subjectRef(Map<String, Probe> plan, Probe probe, String subjectId) {
        Probe current = probe;
        while (current instanceof AggregateProbe aggregate) {
            current = plan.get(aggregate.componentProbeIds().get(0));
        }
        String key = current instanceof LeafProbe leaf ? leaf.subjectParameter() : "subject";
        return Map.of(key, subjectId == null ? "" : subjectId);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> params) {
        Map<String, Object> copy = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
