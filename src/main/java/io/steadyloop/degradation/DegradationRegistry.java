package io.steadyloop.degradation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

public final class DegradationRegistry {
    private static final Logger log = LoggerFactory.getLogger(DegradationRegistry.class);
    private static final Comparator<Workaround> BEST_FIRST = Comparator.comparingDouble(Workaround::qualityLoss);

    private final Map<String, List<Workaround>> workarounds = new LinkedHashMap<>();
    private final Map<String, ComponentStatus> statuses = new LinkedHashMap<>();
    private long workaroundsUsed;
    private long workaroundSuccesses;
    private long failuresHandled;

    public synchronized void registerWorkaround(Workaround workaround) {
        workarounds.computeIfAbsent(workaround.component(), c -> new ArrayList<>()).add(workaround);
    }

    public Workaround registerWorkaround(String component, String name, double qualityLoss,
                                         String description, FallbackAction action) {
        Workaround w = new Workaround(component, name, qualityLoss, description, action);
        registerWorkaround(w);
        return w;
    }

    public Optional<DegradedOutcome> handleFailure(String component, Throwable error) {
        List<Workaround> candidates;
        synchronized (this) {
            failuresHandled++;
            candidates = new ArrayList<>(workarounds.getOrDefault(component, List.of()));
        }
        candidates.sort(BEST_FIRST);
        for (Workaround w : candidates) {
            synchronized (this) {
                workaroundsUsed++;
            }
            try {
                Object result = w.attempt(error);
                synchronized (this) {
                    workaroundSuccesses++;
                    statuses.put(component, ComponentStatus.DEGRADED);
                }
                log.warn("Component {} degraded, using workaround {} (quality loss {})",
                        component, w.name(), w.qualityLoss());
                return Optional.of(new DegradedOutcome(true, component, w.name(), w.description(), w.qualityLoss(), result));
            } catch (Exception e) {
                log.warn("Workaround {} for component {} failed", w.name(), component, e);
            }
        }
        synchronized (this) {
            statuses.put(component, ComponentStatus.FAILED);
        }
        log.warn("Component {} failed with no working workaround ({} tried)", component, candidates.size());
        return Optional.empty();
    }

    public <T> T executeWithDegradation(String component, Callable<T> work,
                                        Function<DegradedOutcome, T> onDegraded) throws Exception {
        try {
            T result = work.call();
            restoreComponent(component);
            return result;
        } catch (Exception e) {
            Optional<DegradedOutcome> outcome = handleFailure(component, e);
            if (outcome.isPresent()) {
                return onDegraded.apply(outcome.get());
            }
            throw e;
        }
    }

    public synchronized void restoreComponent(String component) {
        ComponentStatus previous = statuses.put(component, ComponentStatus.OPERATIONAL);
        if (previous != null && previous != ComponentStatus.OPERATIONAL) {
            log.info("Component {} restored ({} -> OPERATIONAL)", component, previous);
        }
    }

    public synchronized void bypassComponent(String component) {
        statuses.put(component, ComponentStatus.BYPASSED);
        log.info("Component {} bypassed", component);
    }

    public synchronized ComponentStatus componentStatus(String component) {
        return statuses.getOrDefault(component, ComponentStatus.OPERATIONAL);
    }

    public synchronized DegradationLevel degradationLevel() {
        if (statuses.isEmpty()) {
            return DegradationLevel.FULL;
        }
        double total = statuses.size();
        double failed = count(ComponentStatus.FAILED) / total;
        double degraded = count(ComponentStatus.DEGRADED) / total;
        if (failed > 0.5d) {
            return DegradationLevel.MINIMAL;
        }
        if (failed > 0.3d || degraded > 0.5d) {
            return DegradationLevel.SEVERE;
        }
        if (failed > 0.1d || degraded > 0.3d) {
            return DegradationLevel.MODERATE;
        }
        if (degraded > 0.1d) {
            return DegradationLevel.MINOR;
        }
        return DegradationLevel.FULL;
    }

    public synchronized boolean canContinue() {
        return degradationLevel() != DegradationLevel.MINIMAL || count(ComponentStatus.OPERATIONAL) > 0;
    }

    public synchronized Optional<Workaround> bestWorkaround(String component) {
        return workarounds.getOrDefault(component, List.of()).stream().min(BEST_FIRST);
    }

    public synchronized List<Workaround> workaroundsFor(String component) {
        List<Workaround> out = new ArrayList<>(workarounds.getOrDefault(component, List.of()));
        out.sort(BEST_FIRST);
        return List.copyOf(out);
    }

    public synchronized DegradationReport report() {
        Map<String, List<DegradationReport.WorkaroundSummary>> summaries = new LinkedHashMap<>();
        for (Map.Entry<String, List<Workaround>> e : workarounds.entrySet()) {
            List<DegradationReport.WorkaroundSummary> list = new ArrayList<>();
            for (Workaround w : e.getValue()) {
                list.add(new DegradationReport.WorkaroundSummary(
                        w.name(), w.description(), w.qualityLoss(), w.usageCount(), w.successRate()));
            }
            summaries.put(e.getKey(), List.copyOf(list));
        }
        return new DegradationReport(
                degradationLevel(),
                canContinue(),
                componentsWith(ComponentStatus.OPERATIONAL),
                componentsWith(ComponentStatus.DEGRADED),
                componentsWith(ComponentStatus.FAILED),
                componentsWith(ComponentStatus.BYPASSED),
                workaroundsUsed,
                workaroundSuccesses,
                failuresHandled,
                summaries
        );
    }

    private int count(ComponentStatus status) {
        int n = 0;
        for (ComponentStatus s : statuses.values()) {
            if (s == status) {
                n++;
            }
        }
        return n;
    }

    private List<String> componentsWith(ComponentStatus status) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, ComponentStatus> e : statuses.entrySet()) {
            if (e.getValue() == status) {
                out.add(e.getKey());
            }
        }
        return List.copyOf(out);
    }
}
