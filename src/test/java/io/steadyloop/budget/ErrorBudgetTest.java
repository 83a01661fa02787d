package io.steadyloop.budget;

import io.steadyloop.error.TransientTaskException;
import io.steadyloop.support.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

final class ErrorBudgetTest {
    private static final AtomicInteger DISTINCT = new AtomicInteger();

    @Test
    void statusFollowsUsageAgainstThresholds() {
        ErrorBudget budget = new ErrorBudget(10, 0.8d, 1.5d, MutableClock.startingAt(0L));
        Assertions.assertEquals(BudgetStatus.HEALTHY, budget.currentStatus());

        recordDistinct(budget, 4);
        Assertions.assertEquals(BudgetStatus.DEGRADED, budget.currentStatus());
        recordDistinct(budget, 4);
        Assertions.assertEquals(BudgetStatus.CRITICAL, budget.currentStatus());
        recordDistinct(budget, 7);
        Assertions.assertEquals(BudgetStatus.EXCEEDED, budget.currentStatus());
        Assertions.assertEquals(15, budget.errorsLastHour());
        Assertions.assertEquals(0.25d, budget.errorRatePerMinute(), 1e-9);
    }

    @Test
    void singleTypePastItsShareSaysStop() {
        ErrorBudget budget = new ErrorBudget(10, 0.8d, 1.5d, MutableClock.startingAt(0L));
        for (int i = 0; i < 5; i++) {
            Assertions.assertTrue(budget.recordError(new TransientTaskException("x"), "network").shouldContinue());
        }
        BudgetDecision sixth = budget.recordError(new TransientTaskException("x"), "network");

        Assertions.assertFalse(sixth.shouldContinue());
        Assertions.assertEquals("network exceeds its own budget (6/5)", sixth.reason());
        Assertions.assertEquals("Fix network errors", sixth.recommendation());
        Assertions.assertEquals(BudgetStatus.DEGRADED, sixth.status());
        Assertions.assertTrue(budget.recordError(new TransientTaskException("y"), "database").shouldContinue());
    }

    @Test
    void typeShareStopsEvenWhenOverBudgetErrorsAreDiverse() {
        ErrorBudget budget = new ErrorBudget(10, 0.8d, 1.5d, MutableClock.startingAt(0L));
        for (int i = 0; i < 9; i++) {
            budget.recordError(null, "other-" + i);
        }
        for (int i = 0; i < 5; i++) {
            Assertions.assertTrue(budget.recordError(null, "network").shouldContinue());
        }
        BudgetDecision sixth = budget.recordError(null, "network");

        Assertions.assertEquals(BudgetStatus.EXCEEDED, sixth.status());
        Assertions.assertFalse(sixth.shouldContinue());
        Assertions.assertEquals("network exceeds its own budget (6/5)", sixth.reason());
        Assertions.assertEquals(0.8d, sixth.confidence());
    }

    @Test
    void explicitTypeBudgetOverridesTheDefaultShare() {
        ErrorBudget budget = new ErrorBudget(10, 0.8d, 1.5d, MutableClock.startingAt(0L));
        budget.setTypeBudget("timeout", 1);
        Assertions.assertTrue(budget.recordError(null, "timeout").shouldContinue());
        Assertions.assertFalse(budget.recordError(null, "timeout").shouldContinue());
    }

    @Test
    void overBudgetDiverseErrorsContinueButConcentratedOnesStop() {
        ErrorBudget diverse = new ErrorBudget(10, 0.8d, 1.5d, MutableClock.startingAt(0L));
        BudgetDecision last = null;
        for (int i = 0; i < 16; i++) {
            last = diverse.recordError(null, "type-" + i);
        }
        Assertions.assertEquals(BudgetStatus.EXCEEDED, last.status());
        Assertions.assertTrue(last.shouldContinue());
        Assertions.assertEquals(0.7d, last.confidence());

        ErrorBudget concentrated = new ErrorBudget(10, 0.8d, 1.5d, MutableClock.startingAt(0L));
        concentrated.setTypeBudget("database", 1_000);
        for (int i = 0; i < 14; i++) {
            Assertions.assertTrue(concentrated.recordError(null, "database").shouldContinue());
        }
        BudgetDecision stop = concentrated.recordError(null, "database");
        Assertions.assertFalse(stop.shouldContinue());
        Assertions.assertEquals("Over budget with concentrated errors", stop.reason());
        Assertions.assertEquals("Investigate error patterns", stop.recommendation());
    }

    @Test
    void errorsAgeOutOfTheOneHourWindow() {
        MutableClock clock = MutableClock.startingAt(0L);
        ErrorBudget budget = new ErrorBudget(10, 0.8d, 1.5d, clock);
        recordDistinct(budget, 9);
        Assertions.assertEquals(BudgetStatus.CRITICAL, budget.currentStatus());

        clock.advance(Duration.ofMinutes(59));
        Assertions.assertEquals(9, budget.errorsLastHour());
        clock.advance(Duration.ofMinutes(1));
        Assertions.assertEquals(0, budget.errorsLastHour());
        Assertions.assertEquals(BudgetStatus.HEALTHY, budget.currentStatus());
    }

    @Test
    void trendComparesTheTwoHalvesOfTheWindow() {
        MutableClock clock = MutableClock.startingAt(0L);
        ErrorBudget budget = new ErrorBudget(100, 0.8d, 1.5d, clock);
        Assertions.assertEquals(ErrorTrend.STABLE, budget.trend());

        recordDistinct(budget, 2);
        clock.advance(Duration.ofMinutes(31));
        Assertions.assertEquals(ErrorTrend.DECREASING, budget.trend());
        recordDistinct(budget, 5);
        Assertions.assertEquals(ErrorTrend.INCREASING, budget.trend());
    }

    @Test
    void typeIsTrendingWhenItClustersInTheLastFiveMinutes() {
        MutableClock clock = MutableClock.startingAt(0L);
        ErrorBudget budget = new ErrorBudget(100, 0.8d, 1.5d, clock);
        budget.recordError(null, "network");
        clock.advance(Duration.ofMinutes(6));
        budget.recordError(null, "network");
        budget.recordError(null, "network");
        Assertions.assertTrue(budget.isTrending("network"));
        Assertions.assertFalse(budget.isTrending("database"));

        budget.recordError(null, "resource");
        budget.recordError(null, "resource");
        Assertions.assertFalse(budget.isTrending("resource"));
    }

    @Test
    void reportSummarisesTypesAndRecommendations() {
        ErrorBudget budget = new ErrorBudget(10, 0.8d, 1.5d, MutableClock.startingAt(0L));
        budget.setTypeBudget("network", 100);
        for (int i = 0; i < 5; i++) {
            budget.recordError(null, "network");
        }
        budget.recordError(null, "database");

        BudgetReport report = budget.report();
        Assertions.assertEquals(BudgetStatus.DEGRADED, report.status());
        Assertions.assertEquals(6, report.errorsLastHour());
        Assertions.assertEquals(4, report.budgetRemaining());
        Assertions.assertEquals(60.0d, report.usagePercentage(), 1e-9);
        Assertions.assertEquals(Map.entry("network", 5), report.topErrorTypes().get(0));
        Assertions.assertEquals(List.of("network"), report.trendingTypes());
        Assertions.assertEquals(List.of("Error rate elevated but manageable", "Recurring: network (5 times)"),
                report.recommendations());
        Assertions.assertEquals(6L, report.stopsPrevented());
    }

    @Test
    void adjustAndResetChangeTheWindow() {
        ErrorBudget budget = new ErrorBudget(10, 0.8d, 1.5d, MutableClock.startingAt(0L));
        recordDistinct(budget, 8);
        Assertions.assertEquals(BudgetStatus.CRITICAL, budget.currentStatus());

        budget.adjustBudget(100);
        Assertions.assertEquals(BudgetStatus.HEALTHY, budget.currentStatus());
        Assertions.assertEquals(100, budget.budgetPerHour());
        Assertions.assertThrows(IllegalArgumentException.class, () -> budget.adjustBudget(0));

        budget.reset();
        Assertions.assertEquals(0, budget.errorsLastHour());
        Assertions.assertEquals(0L, budget.report().totalErrors());
    }

    private static void recordDistinct(ErrorBudget budget, int count) {
        for (int i = 0; i < count; i++) {
            budget.recordError(new TransientTaskException("e" + i), "kind-" + DISTINCT.incrementAndGet());
        }
    }
}
