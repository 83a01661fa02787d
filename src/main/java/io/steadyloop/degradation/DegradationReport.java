package io.steadyloop.degradation;

import java.util.List;
import java.util.Map;

public record DegradationReport(
        DegradationLevel level,
        boolean canContinue,
        List<String> operational,
        List<String> degraded,
        List<String> failed,
        List<String> bypassed,
        long workaroundsUsed,
        long workaroundSuccesses,
        long failuresHandled,
        Map<String, List<WorkaroundSummary>> workarounds
) {
    public record WorkaroundSummary(
            String name,
            String description,
            double qualityLoss,
            long usageCount,
            double successRate
    ) {
    }
}
