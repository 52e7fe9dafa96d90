package com.motaz.fraudscan.engine;

import com.motaz.fraudscan.engine.model.Severity;

/**
 * Fixed severity tiers shared by both detectors. The tiers apply to the
 * deviation itself and ignore the caller's alert threshold; changing them
 * is a product decision, so they are constants rather than properties.
 */
public final class SeverityClassifier {

    public static final double HIGH_ABOVE_PERCENT = 500.0;
    public static final double CRITICAL_ABOVE_PERCENT = 1000.0;

    private SeverityClassifier() {
    }

    public static Severity classify(double deviationPercent) {
        if (deviationPercent > CRITICAL_ABOVE_PERCENT) {
            return Severity.CRITICAL;
        }
        if (deviationPercent > HIGH_ABOVE_PERCENT) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }
}
