package tech.noetzold.screening_api.orchestrator;

import lombok.extern.slf4j.Slf4j;
import tech.noetzold.screening_api.cache.FetchCache;
import tech.noetzold.screening_api.client.ProviderClient;
import tech.noetzold.screening_api.exception.ConfigurationException;
import tech.noetzold.screening_api.model.RiskRecord;
import tech.noetzold.screening_api.probe.LeafProbe;
import tech.noetzold.screening_api.probe.Probe;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs screening checks for one subject. Every {@link #execute} call gets its own
 * {@link ScreeningSession} and with it a fresh {@link FetchCache}; callers that want several
 * executions to share fetched payloads open a session themselves.
 */
@Slf4j
public class ScreeningOrchestrator {

    private final ProbeRegistry registry;
    private final Map<String, ProviderClient> clients = new LinkedHashMap<>();
    private final DescriptionLookup descriptions;
    private final Executor executor;
    private final Duration providerTimeout;

    public ScreeningOrchestrator(ProbeRegistry registry, Collection<? extends ProviderClient> clients,
                                 DescriptionLookup descriptions, Executor executor, Duration providerTimeout) {
        this.registry = registry;
        this.descriptions = descriptions == null ? DescriptionLookup.none() : descriptions;
        this.executor = executor;
        this.providerTimeout = providerTimeout;
        for (ProviderClient client : clients) {
            if (this.clients.putIfAbsent(client.providerId(), client) != null) {
                throw new ConfigurationException("Provider registered twice: " + client.providerId(), client.providerId());
            }
        }
        registry.all().forEach(this::requireClient);
        log.info("Screening orchestrator ready with {} probes and {} providers", registry.all().size(), this.clients.size());
    }

    /**
     * Adds a probe after startup. Serialized against plan resolution of running executions.
     */
    public void register(String probeId, Probe probe) {
        if (!probeId.equals(probe.id())) {
            throw new ConfigurationException("Registration id " + probeId + " does not match probe id " + probe.id(), probeId);
        }
        requireClient(probe);
        registry.register(probe);
        log.info("Registered probe {}", probeId);
    }

    public ScreeningSession openSession() {
        return new ScreeningSession(this, new FetchCache());
    }

    public List<RiskRecord> execute(List<String> checkIds, String subjectId, Map<String, Object> params) {
        try (ScreeningSession session = openSession()) {
            return session.execute(checkIds, subjectId, params);
        }
    }

    public CompletableFuture<List<RiskRecord>> executeAsync(List<String> checkIds, String subjectId, Map<String, Object> params) {
        ScreeningSession session = openSession();
        try {
            CompletableFuture<List<RiskRecord>> result = session.executeAsync(checkIds, subjectId, params);
            result.whenComplete((records, error) -> session.close());
            return result;
        } catch (ConfigurationException e) {
            session.close();
            throw e;
        }
    }

    public ProbeRegistry registry() {
        return registry;
    }

    ProviderClient client(String providerId) {
        ProviderClient client = clients.get(providerId);
        if (client == null) {
            throw new ConfigurationException("No client for provider " + providerId, providerId);
        }
        return client;
    }

    DescriptionLookup descriptions() {
        return descriptions;
    }

    Executor executor() {
        return executor;
    }

    Duration providerTimeout() {
        return providerTimeout;
    }

    private void requireClient(Probe probe) {
        if (probe instanceof LeafProbe leaf && !clients.containsKey(leaf.providerId())) {
            throw ConfigurationException.unknownProvider(leaf.id(), leaf.providerId());
        }
    }
}
