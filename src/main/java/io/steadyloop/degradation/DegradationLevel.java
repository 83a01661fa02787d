package io.steadyloop.degradation;

public enum DegradationLevel {
    FULL,
    MINOR,
    MODERATE,
    SEVERE,
    MINIMAL;

    public boolean worseThan(DegradationLevel other) {
        return ordinal() > other.ordinal();
    }
}
