package io.steadyloop.decision;

public enum Impact {
    LOW(0.1d),
    MEDIUM(0.0d),
    HIGH(-0.2d),
    CRITICAL(-0.3d);

    private final double adjustment;

    Impact(double adjustment) {
        this.adjustment = adjustment;
    }

    public double adjustment() {
        return adjustment;
    }
}
