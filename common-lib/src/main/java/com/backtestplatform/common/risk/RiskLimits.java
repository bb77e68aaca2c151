package com.backtestplatform.common.risk;

/**
 * Configured limits the {@link RiskManager} enforces.
 *
 * @param maxPositionFraction largest share of total portfolio value one ticker's gross
 *                            exposure may reach (0.20 = 20%)
 * @param marginRequirement   fraction of a short's notional reserved as margin; 0 means
 *                            shorts are bounded by the position limit only
 */
public record RiskLimits(double maxPositionFraction, double marginRequirement) {

    public static final double DEFAULT_MAX_POSITION_FRACTION = 0.20;

    public RiskLimits {
        if (!(maxPositionFraction > 0.0) || maxPositionFraction > 1.0) {
            throw new IllegalArgumentException("maxPositionFraction must be in (0, 1]: " + maxPositionFraction);
        }
        if (marginRequirement < 0.0 || marginRequirement > 1.0) {
            throw new IllegalArgumentException("marginRequirement must be in [0, 1]: " + marginRequirement);
        }
    }

    public static RiskLimits withMargin(double marginRequirement) {
        return new RiskLimits(DEFAULT_MAX_POSITION_FRACTION, marginRequirement);
    }
}
