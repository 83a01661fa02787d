package io.steadyloop.retry;

import io.steadyloop.error.CircuitOpenException;
import io.steadyloop.error.ErrorClassifier;
import io.steadyloop.error.ErrorKind;
import io.steadyloop.model.TaskCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

public final class RetryEngine {
    private static final Logger log = LoggerFactory.getLogger(RetryEngine.class);
    static final int HISTORY_SIZE = 100;
    static final int MIN_SAMPLES_TO_ADAPT = 10;

    private final Map<TaskCategory, RetryPolicy> initialPolicies;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenAttempts;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;
    private final CircuitBreaker.TransitionListener transitionListener;
    private final ConcurrentHashMap<TaskCategory, CategoryState> states;

    public RetryEngine(Map<TaskCategory, RetryPolicy> policyOverrides,
                       int failureThreshold,
                       Duration recoveryTimeout,
                       int halfOpenAttempts,
                       Clock clock,
                       Sleeper sleeper,
                       CircuitBreaker.TransitionListener transitionListener) {
        this(policyOverrides, failureThreshold, recoveryTimeout, halfOpenAttempts, clock, sleeper,
                () -> ThreadLocalRandom.current().nextDouble(-1.0d, 1.0d), transitionListener);
    }

    RetryEngine(Map<TaskCategory, RetryPolicy> policyOverrides,
                int failureThreshold,
                Duration recoveryTimeout,
                int halfOpenAttempts,
                Clock clock,
                Sleeper sleeper,
                DoubleSupplier jitterSource,
                CircuitBreaker.TransitionListener transitionListener) {
        Map<TaskCategory, RetryPolicy> policies = new EnumMap<>(TaskCategory.class);
        for (TaskCategory c : TaskCategory.values()) {
            RetryPolicy override = policyOverrides == null ? null : policyOverrides.get(c);
            policies.put(c, override == null ? RetryPolicy.defaultFor(c) : override);
        }
        this.initialPolicies = policies;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.halfOpenAttempts = halfOpenAttempts;
        this.clock = clock;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
        this.jitterSource = jitterSource;
        this.transitionListener = transitionListener;
        this.states = new ConcurrentHashMap<>();
    }

    public <T> T executeWithRetry(TaskCategory category, Callable<T> work) throws Exception {
        CategoryState st = state(category);
        RetryPolicy policy = st.policy();
        int attempt = 0;
        while (true) {
            if (!st.breaker.canAttempt()) {
                st.recordRejection(attempt > 0);
                throw new CircuitOpenException(category);
            }
            st.recordAttempt();
            try {
                T result = work.call();
                st.recordSuccess();
                return result;
            } catch (Exception e) {
                ErrorKind kind = ErrorClassifier.classify(e);
                st.breaker.recordFailure();
                if (!kind.retryable() || attempt >= policy.maxRetries()) {
                    st.recordExecutionFailure();
                    throw e;
                }
                Duration delay = policy.delayFor(attempt, jitterSource.getAsDouble());
                log.debug("Retrying {} attempt {}/{} in {}ms after {}",
                        category.key(), attempt + 1, policy.maxRetries(), delay.toMillis(), ErrorClassifier.errorType(e));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    st.recordExecutionFailure();
                    throw e;
                }
                attempt++;
            }
        }
    }

    public RetryPolicy adaptPolicy(TaskCategory category) {
        CategoryState st = state(category);
        st.lock.lock();
        try {
            if (st.history.size() < MIN_SAMPLES_TO_ADAPT) {
                return st.policy;
            }
            double rate = st.successRateLocked();
            RetryPolicy next = st.policy.adapted(rate);
            if (!next.equals(st.policy)) {
                log.info("Adapted {} retry policy: maxRetries {} -> {}, maxDelay {}ms -> {}ms (successRate={})",
                        category.key(), st.policy.maxRetries(), next.maxRetries(),
                        st.policy.maxDelay().toMillis(), next.maxDelay().toMillis(), String.format("%.2f", rate));
                st.policy = next;
            }
            return st.policy;
        } finally {
            st.lock.unlock();
        }
    }

    public void adaptAll() {
        for (TaskCategory category : states.keySet()) {
            adaptPolicy(category);
        }
    }

    public double successRate(TaskCategory category) {
        CategoryState st = states.get(category);
        if (st == null) {
            return 1.0d;
        }
        st.lock.lock();
        try {
            return st.successRateLocked();
        } finally {
            st.lock.unlock();
        }
    }

    public RetryPolicy policy(TaskCategory category) {
        return state(category).policy();
    }

    public CircuitState circuitState(TaskCategory category) {
        CategoryState st = states.get(category);
        return st == null ? CircuitState.CLOSED : st.breaker.state();
    }

    public void resetCircuit(TaskCategory category) {
        state(category).breaker.reset();
    }

    public RetryStats stats() {
        Map<TaskCategory, CategoryStats> out = new EnumMap<>(TaskCategory.class);
        for (Map.Entry<TaskCategory, CategoryState> e : states.entrySet()) {
            out.put(e.getKey(), e.getValue().stats(e.getKey()));
        }
        return new RetryStats(out);
    }

    private CategoryState state(TaskCategory category) {
        return states.computeIfAbsent(category, c -> new CategoryState(
                initialPolicies.get(c),
                new CircuitBreaker(c, failureThreshold, recoveryTimeout, halfOpenAttempts, clock, transitionListener)
        ));
    }

    private static final class CategoryState {
        private final ReentrantLock lock = new ReentrantLock();
        private final CircuitBreaker breaker;
        private final Deque<Boolean> history = new ArrayDeque<>();
        private RetryPolicy policy;
        private long executions;
        private long attempts;
        private long successes;
        private long failures;
        private long rejections;

        private CategoryState(RetryPolicy policy, CircuitBreaker breaker) {
            this.policy = policy;
            this.breaker = breaker;
        }

        RetryPolicy policy() {
            lock.lock();
            try {
                return policy;
            } finally {
                lock.unlock();
            }
        }

        void recordAttempt() {
            lock.lock();
            try {
                attempts++;
            } finally {
                lock.unlock();
            }
        }

        void recordSuccess() {
            breaker.recordSuccess();
            lock.lock();
            try {
                successes++;
                pushHistory(true);
            } finally {
                lock.unlock();
            }
        }

        void recordExecutionFailure() {
            lock.lock();
            try {
                failures++;
                pushHistory(false);
            } finally {
                lock.unlock();
            }
        }

        // A rejection after at least one attempt ends an execution that already started.
        void recordRejection(boolean midExecution) {
            lock.lock();
            try {
                rejections++;
                if (midExecution) {
                    failures++;
                    pushHistory(false);
                }
            } finally {
                lock.unlock();
            }
        }

        double successRateLocked() {
            if (history.isEmpty()) {
                return 1.0d;
            }
            int ok = 0;
            for (Boolean b : history) {
                if (b) {
                    ok++;
                }
            }
            return (double) ok / history.size();
        }

        CategoryStats stats(TaskCategory category) {
            lock.lock();
            try {
                return new CategoryStats(category, executions, attempts, successes, failures, rejections,
                        successRateLocked(), policy, breaker.snapshot());
            } finally {
                lock.unlock();
            }
        }

        private void pushHistory(boolean ok) {
            executions++;
            history.addLast(ok);
            while (history.size() > HISTORY_SIZE) {
                history.removeFirst();
            }
        }
    }
}
