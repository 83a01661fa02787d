package io.steadyloop.decision;

import java.util.List;

public record ConfidenceReport(
        int totalDecisions,
        double autonomousRate,
        double successRate,
        Thresholds thresholds,
        List<ConfidenceDecision> recentDecisions
) {
}
