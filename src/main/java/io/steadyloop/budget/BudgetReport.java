package io.steadyloop.budget;

import java.util.List;
import java.util.Map;

public record BudgetReport(
        BudgetStatus status,
        int budgetPerHour,
        int errorsLastHour,
        int budgetRemaining,
        double usagePercentage,
        double errorRatePerMinute,
        double typeDiversity,
        long totalErrors,
        long stopsPrevented,
        List<Map.Entry<String, Integer>> topErrorTypes,
        List<String> trendingTypes,
        ErrorTrend trend,
        List<String> recommendations
) {
}
