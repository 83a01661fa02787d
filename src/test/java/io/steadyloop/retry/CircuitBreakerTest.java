package io.steadyloop.retry;

import io.steadyloop.model.TaskCategory;
import io.steadyloop.support.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

final class CircuitBreakerTest {

    @Test
    void opensAtThresholdAndRejectsUntilRecoveryTimeout() {
        MutableClock clock = MutableClock.startingAt(0L);
        List<String> transitions = new ArrayList<>();
        CircuitBreaker breaker = new CircuitBreaker(TaskCategory.NETWORK, 3, Duration.ofSeconds(60), 1, clock,
                (category, from, to) -> transitions.add(from + "->" + to));

        for (int i = 0; i < 2; i++) {
            Assertions.assertTrue(breaker.canAttempt());
            breaker.recordFailure();
        }
        Assertions.assertEquals(CircuitState.CLOSED, breaker.state());
        Assertions.assertTrue(breaker.canAttempt());
        breaker.recordFailure();
        Assertions.assertEquals(CircuitState.OPEN, breaker.state());
        Assertions.assertFalse(breaker.canAttempt());

        clock.advance(Duration.ofSeconds(59));
        Assertions.assertFalse(breaker.canAttempt());
        clock.advance(Duration.ofSeconds(1));
        Assertions.assertTrue(breaker.canAttempt());
        Assertions.assertEquals(CircuitState.HALF_OPEN, breaker.state());
        Assertions.assertFalse(breaker.canAttempt(), "only one trial call admitted");

        breaker.recordSuccess();
        Assertions.assertEquals(CircuitState.CLOSED, breaker.state());
        Assertions.assertEquals(0, breaker.snapshot().failureCount());
        Assertions.assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void failedTrialCallReopensAndRestartsTheTimeout() {
        MutableClock clock = MutableClock.startingAt(0L);
        CircuitBreaker breaker = new CircuitBreaker(TaskCategory.DATABASE, 1, Duration.ofSeconds(10), 2, clock);
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(10));

        Assertions.assertTrue(breaker.canAttempt());
        Assertions.assertTrue(breaker.canAttempt());
        Assertions.assertFalse(breaker.canAttempt());
        breaker.recordSuccess();
        Assertions.assertEquals(CircuitState.HALF_OPEN, breaker.state());
        breaker.recordFailure();
        Assertions.assertEquals(CircuitState.OPEN, breaker.state());

        clock.advance(Duration.ofSeconds(9));
        Assertions.assertFalse(breaker.canAttempt());
        clock.advance(Duration.ofSeconds(1));
        Assertions.assertTrue(breaker.canAttempt());
    }

    @Test
    void successWhileClosedWorksOffOneFailure() {
        CircuitBreaker breaker = new CircuitBreaker(TaskCategory.DEFAULT, 3, Duration.ofSeconds(1), 1,
                MutableClock.startingAt(0L));
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        Assertions.assertEquals(CircuitState.CLOSED, breaker.state());
        Assertions.assertEquals(2, breaker.snapshot().failureCount());
    }

    @Test
    void resetClosesImmediately() {
        CircuitBreaker breaker = new CircuitBreaker(TaskCategory.DEFAULT, 1, Duration.ofHours(1), 1,
                MutableClock.startingAt(0L));
        breaker.recordFailure();
        Assertions.assertFalse(breaker.canAttempt());
        breaker.reset();
        Assertions.assertTrue(breaker.canAttempt());
        Assertions.assertNull(breaker.snapshot().lastFailureAtMs());
    }

    @Test
    void rejectsInvalidConfiguration() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker(TaskCategory.DEFAULT, 0, Duration.ZERO, 1, MutableClock.startingAt(0L)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker(TaskCategory.DEFAULT, 1, Duration.ZERO, 0, MutableClock.startingAt(0L)));
    }
}
