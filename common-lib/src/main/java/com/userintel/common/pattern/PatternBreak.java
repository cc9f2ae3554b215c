package com.userintel.common.pattern;

/**
 * One observation that departs from the user's baseline.
 *
 * @param expected  what the baseline predicted, rendered for display
 * @param actual    what was observed, rendered for display
 * @param deviation relative size of the departure (unitless)
 * @param above     true when the observed value is larger than the baseline
 */
public record PatternBreak(
    BreakDimension dimension,
    String expected,
    String actual,
    double deviation,
    Significance significance,
    boolean above
) {
    public boolean worthSurfacing() {
        return significance == Significance.MEDIUM || significance == Significance.HIGH;
    }
}
