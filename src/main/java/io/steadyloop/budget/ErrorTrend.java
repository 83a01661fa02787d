package io.steadyloop.budget;

public enum ErrorTrend {
    INCREASING,
    DECREASING,
    STABLE
}
