package io.steadyloop.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ErrorBudget {
    private static final Logger log = LoggerFactory.getLogger(ErrorBudget.class);
    static final Duration WINDOW = Duration.ofHours(1);
    static final Duration TYPE_TREND_WINDOW = Duration.ofMinutes(10);
    private static final int RECURRING_THRESHOLD = 5;

    private final Clock clock;
    private final double warningThreshold;
    private final double criticalThreshold;
    private final Deque<ErrorEvent> events;
    private final Map<String, Integer> typeBudgets;
    private int budgetPerHour;
    private BudgetStatus status;
    private long totalErrors;
    private long stopsPrevented;

    public ErrorBudget(int budgetPerHour, double warningThreshold, double criticalThreshold, Clock clock) {
        if (budgetPerHour < 1) {
            throw new IllegalArgumentException("budgetPerHour must be >= 1: " + budgetPerHour);
        }
        this.budgetPerHour = budgetPerHour;
        this.warningThreshold = warningThreshold;
        this.criticalThreshold = criticalThreshold;
        this.clock = clock;
        this.events = new ArrayDeque<>();
        this.typeBudgets = new HashMap<>();
        this.status = BudgetStatus.HEALTHY;
    }

    public synchronized BudgetDecision recordError(Throwable error, String errorType) {
        String type = errorType == null || errorType.isBlank()
                ? (error == null ? "unknown" : error.getClass().getSimpleName())
                : errorType;
        long now = clock.millis();
        events.addLast(new ErrorEvent(now, type));
        totalErrors++;
        purge(now);
        status = computeStatus();
        BudgetDecision decision = decide(type);
        if (!decision.shouldContinue()) {
            log.warn("Error budget says stop: {} ({})", decision.reason(), decision.recommendation());
        }
        return decision;
    }

    public synchronized void setTypeBudget(String errorType, int budget) {
        typeBudgets.put(errorType, Math.max(0, budget));
    }

    public synchronized void adjustBudget(int newBudgetPerHour) {
        if (newBudgetPerHour < 1) {
            throw new IllegalArgumentException("budgetPerHour must be >= 1: " + newBudgetPerHour);
        }
        log.info("Error budget adjusted {} -> {} per hour", budgetPerHour, newBudgetPerHour);
        budgetPerHour = newBudgetPerHour;
        purge(clock.millis());
        status = computeStatus();
    }

    public synchronized BudgetStatus currentStatus() {
        purge(clock.millis());
        status = computeStatus();
        return status;
    }

    public synchronized int budgetPerHour() {
        return budgetPerHour;
    }

    public synchronized int errorsLastHour() {
        purge(clock.millis());
        return events.size();
    }

    public synchronized double errorRatePerMinute() {
        purge(clock.millis());
        return events.size() / (double) WINDOW.toMinutes();
    }

    public synchronized List<Map.Entry<String, Integer>> topErrorTypes(int limit) {
        purge(clock.millis());
        List<Map.Entry<String, Integer>> counts = new ArrayList<>();
        for (Map.Entry<String, Integer> e : countsByType().entrySet()) {
            counts.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue()));
        }
        counts.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        return List.copyOf(counts.subList(0, Math.min(Math.max(0, limit), counts.size())));
    }

    public synchronized ErrorTrend trend() {
        long now = clock.millis();
        purge(now);
        long half = WINDOW.toMillis() / 2L;
        int older = 0;
        int newer = 0;
        for (ErrorEvent e : events) {
            if (e.atMs() >= now - half) {
                newer++;
            } else {
                older++;
            }
        }
        if (newer > older) {
            return ErrorTrend.INCREASING;
        }
        if (newer < older) {
            return ErrorTrend.DECREASING;
        }
        return ErrorTrend.STABLE;
    }

    public synchronized boolean isTrending(String errorType) {
        long now = clock.millis();
        long start = now - TYPE_TREND_WINDOW.toMillis();
        long mid = now - TYPE_TREND_WINDOW.toMillis() / 2L;
        int total = 0;
        int first = 0;
        int second = 0;
        for (ErrorEvent e : events) {
            if (!e.type().equals(errorType)) {
                continue;
            }
            total++;
            if (e.atMs() >= mid) {
                second++;
            } else if (e.atMs() >= start) {
                first++;
            }
        }
        return total >= 3 && second > first;
    }

    public synchronized BudgetReport report() {
        purge(clock.millis());
        status = computeStatus();
        int count = events.size();
        List<String> trending = new ArrayList<>();
        for (String type : countsByType().keySet()) {
            if (isTrending(type)) {
                trending.add(type);
            }
        }
        return new BudgetReport(
                status,
                budgetPerHour,
                count,
                Math.max(0, budgetPerHour - count),
                count * 100.0d / budgetPerHour,
                errorRatePerMinute(),
                diversity(),
                totalErrors,
                stopsPrevented,
                topErrorTypes(5),
                List.copyOf(trending),
                trend(),
                recommendations(trending)
        );
    }

    public synchronized void reset() {
        events.clear();
        totalErrors = 0L;
        stopsPrevented = 0L;
        status = BudgetStatus.HEALTHY;
        log.info("Error budget reset");
    }

    private BudgetDecision decide(String type) {
        int typeCount = countsByType().getOrDefault(type, 0);
        int typeBudget = typeBudgets.getOrDefault(type, budgetPerHour / 2);
        if (typeCount > typeBudget) {
            return new BudgetDecision(false,
                    type + " exceeds its own budget (" + typeCount + "/" + typeBudget + ")",
                    0.8d, "Fix " + type + " errors", status, type);
        }
        if (status == BudgetStatus.EXCEEDED) {
            if (diversity() > 0.5d) {
                stopsPrevented++;
                return new BudgetDecision(true, "Over budget but errors are diverse (likely transient)",
                        0.7d, "Continue with monitoring", status, type);
            }
            return new BudgetDecision(false, "Over budget with concentrated errors",
                    0.9d, "Investigate error patterns", status, type);
        }
        stopsPrevented++;
        return new BudgetDecision(true, "Within budget (" + events.size() + "/" + budgetPerHour + ")",
                1.0d, "Continue normally", status, type);
    }

    private BudgetStatus computeStatus() {
        double ratio = events.size() / (double) budgetPerHour;
        if (ratio >= criticalThreshold) {
            return BudgetStatus.EXCEEDED;
        }
        if (ratio >= warningThreshold) {
            return BudgetStatus.CRITICAL;
        }
        if (ratio >= warningThreshold * 0.5d) {
            return BudgetStatus.DEGRADED;
        }
        return BudgetStatus.HEALTHY;
    }

    private double diversity() {
        if (events.isEmpty()) {
            return 0.0d;
        }
        return countsByType().size() / (double) events.size();
    }

    private Map<String, Integer> countsByType() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ErrorEvent e : events) {
            counts.merge(e.type(), 1, Integer::sum);
        }
        return counts;
    }

    private List<String> recommendations(List<String> trending) {
        List<String> out = new ArrayList<>();
        switch (status) {
            case EXCEEDED -> {
                out.add("Error budget exceeded, investigate patterns");
                List<Map.Entry<String, Integer>> top = topErrorTypes(3);
                if (!top.isEmpty()) {
                    List<String> names = new ArrayList<>();
                    for (Map.Entry<String, Integer> e : top) {
                        names.add(e.getKey());
                    }
                    out.add("Focus on: " + String.join(", ", names));
                }
            }
            case CRITICAL -> {
                out.add("Approaching error budget limit");
                if (!trending.isEmpty()) {
                    out.add("Trending errors: " + String.join(", ", trending));
                }
            }
            case DEGRADED -> out.add("Error rate elevated but manageable");
            case HEALTHY -> out.add("Error budget healthy, continue normally");
        }
        for (Map.Entry<String, Integer> e : countsByType().entrySet()) {
            if (e.getValue() >= RECURRING_THRESHOLD) {
                out.add("Recurring: " + e.getKey() + " (" + e.getValue() + " times)");
            }
        }
        return List.copyOf(out);
    }

    private void purge(long nowMs) {
        long cutoff = nowMs - WINDOW.toMillis();
        Iterator<ErrorEvent> it = events.iterator();
        while (it.hasNext()) {
            if (it.next().atMs() <= cutoff) {
                it.remove();
            } else {
                break;
            }
        }
    }

    private record ErrorEvent(long atMs, String type) {
    }
}
