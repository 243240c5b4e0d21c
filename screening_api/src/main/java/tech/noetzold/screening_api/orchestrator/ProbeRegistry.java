package tech.noetzold.screening_api.orchestrator;

import tech.noetzold.screening_api.exception.ConfigurationException;
import tech.noetzold.screening_api.probe.AggregateProbe;
import tech.noetzold.screening_api.probe.Probe;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Probe registrations of one orchestrator. Aggregates are registered after their components, which
 * keeps the dependency graph acyclic. Late registrations take the write lock and so wait for
 * in-progress plan lookups.
 */
public class ProbeRegistry {

    private final Map<String, Probe> probes = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ProbeRegistry() {
    }

    public ProbeRegistry(Collection<? extends Probe> initial) {
        initial.forEach(this::register);
    }

    public void register(Probe probe) {
        lock.writeLock().lock();
        try {
            if (probes.containsKey(probe.id())) {
                throw ConfigurationException.duplicate(probe.id());
            }
            if (probe instanceof AggregateProbe aggregate) {
                for (String componentId : aggregate.componentProbeIds()) {
                    if (componentId.equals(probe.id())) {
                        throw ConfigurationException.cycle(probe.id());
                    }
                    if (!probes.containsKey(componentId)) {
                        throw new ConfigurationException("Aggregate probe " + probe.id()
                                + " references unregistered component " + componentId, componentId);
                    }
                }
            }
            probes.put(probe.id(), probe);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Probe get(String probeId) {
        lock.readLock().lock();
        try {
            Probe probe = probes.get(probeId);
            if (probe == null) {
                throw ConfigurationException.unknownCheck(probeId);
            }
            return probe;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String probeId) {
        lock.readLock().lock();
        try {
            return probes.containsKey(probeId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Probe> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(probes.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Requested checks plus every probe they transitively depend on, taken as one consistent
     * snapshot. Unknown ids fail before anything is evaluated.
     */
    public Map<String, Probe> resolve(List<String> checkIds) {
        lock.readLock().lock();
        try {
            Map<String, Probe> plan = new LinkedHashMap<>();
            Deque<String> pending = new ArrayDeque<>(checkIds);
            while (!pending.isEmpty()) {
                String id = pending.pop();
                if (plan.containsKey(id)) {
                    continue;
                }
                Probe probe = probes.get(id);
                if (probe == null) {
                    throw ConfigurationException.unknownCheck(id);
                }
                plan.put(id, probe);
                if (probe instanceof AggregateProbe aggregate) {
                    pending.addAll(aggregate.componentProbeIds());
                }
            }
            return plan;
        } finally {
            lock.readLock().unlock();
        }
    }
}
