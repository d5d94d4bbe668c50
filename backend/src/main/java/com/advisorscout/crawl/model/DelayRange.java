package com.advisorscout.crawl.model;

public record DelayRange(double minSeconds, double maxSeconds) {
    public static final DelayRange NONE = new DelayRange(0, 0);

    public DelayRange {
        if (!Double.isFinite(minSeconds) || !Double.isFinite(maxSeconds)) {
            throw new IllegalArgumentException("Delays must be finite, got " + minSeconds + "s and " + maxSeconds + "s");
        }
        if (minSeconds < 0 || maxSeconds < 0) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (minSeconds > maxSeconds) {
            throw new IllegalArgumentException(
                "Minimum delay " + minSeconds + "s is greater than maximum delay " + maxSeconds + "s"
            );
        }
    }

    public boolean isDisabled() {
        return maxSeconds == 0;
    }
}
