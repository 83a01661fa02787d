package io.steadyloop.runtime;

import io.steadyloop.decision.ActionContext;
import io.steadyloop.degradation.DegradedOutcome;
import io.steadyloop.model.TaskCategory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.function.Function;

public record ProtectedAction<T>(
        String actionId,
        String description,
        Callable<T> work,
        TaskCategory category,
        String component,
        Double confidence,
        ActionContext context,
        String cacheKey,
        Duration cacheTtl,
        Set<String> cacheTags,
        Function<DegradedOutcome, T> onDegraded
) {
    public ProtectedAction {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description is required");
        }
        Objects.requireNonNull(work, "work");
        actionId = actionId == null || actionId.isBlank() ? "action_" + UUID.randomUUID() : actionId;
        category = category == null ? TaskCategory.DEFAULT : category;
        component = component == null || component.isBlank() ? category.key() : component;
        cacheTags = cacheTags == null ? Set.of() : Set.copyOf(cacheTags);
    }

    public static <T> Builder<T> builder(String description, Callable<T> work) {
        return new Builder<>(description, work);
    }

    public static final class Builder<T> {
        private final String description;
        private final Callable<T> work;
        private String actionId;
        private TaskCategory category;
        private String component;
        private Double confidence;
        private ActionContext context;
        private String cacheKey;
        private Duration cacheTtl;
        private Set<String> cacheTags;
        private Function<DegradedOutcome, T> onDegraded;

        private Builder(String description, Callable<T> work) {
            this.description = description;
            this.work = work;
        }

        public Builder<T> actionId(String value) {
            this.actionId = value;
            return this;
        }

        public Builder<T> category(TaskCategory value) {
            this.category = value;
            return this;
        }

        public Builder<T> component(String value) {
            this.component = value;
            return this;
        }

        public Builder<T> confidence(Double value) {
            this.confidence = value;
            return this;
        }

        public Builder<T> context(ActionContext value) {
            this.context = value;
            return this;
        }

        public Builder<T> cache(String key, Duration ttl, Set<String> tags) {
            this.cacheKey = key;
            this.cacheTtl = ttl;
            this.cacheTags = tags;
            return this;
        }

        public Builder<T> onDegraded(Function<DegradedOutcome, T> value) {
            this.onDegraded = value;
            return this;
        }

        public ProtectedAction<T> build() {
            return new ProtectedAction<>(actionId, description, work, category, component, confidence, context,
                    cacheKey, cacheTtl, cacheTags, onDegraded);
        }
    }
}
