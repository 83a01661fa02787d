package io.steadyloop.degradation;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

public final class Workaround {
    private final String component;
    private final String name;
    private final double qualityLoss;
    private final String description;
    private final FallbackAction action;
    private final AtomicLong usageCount = new AtomicLong(0L);
    private final AtomicLong successCount = new AtomicLong(0L);

    public Workaround(String component, String name, double qualityLoss, String description, FallbackAction action) {
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (Double.isNaN(qualityLoss) || qualityLoss < 0.0d || qualityLoss > 1.0d) {
            throw new IllegalArgumentException("qualityLoss must be within [0,1]: " + qualityLoss);
        }
        this.component = component;
        this.name = name;
        this.qualityLoss = qualityLoss;
        this.description = description == null ? "" : description;
        this.action = Objects.requireNonNull(action, "action");
    }

    public String component() {
        return component;
    }

    public String name() {
        return name;
    }

    public double qualityLoss() {
        return qualityLoss;
    }

    public String description() {
        return description;
    }

    public long usageCount() {
        return usageCount.get();
    }

    public long successCount() {
        return successCount.get();
    }

    public double successRate() {
        long used = usageCount.get();
        return used == 0L ? 0.0d : successCount.get() / (double) used;
    }

    Object attempt(Throwable cause) throws Exception {
        usageCount.incrementAndGet();
        Object result = action.run(component, cause);
        successCount.incrementAndGet();
        return result;
    }
}
