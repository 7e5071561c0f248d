package io.github.galkahana.extractionrunner;

import java.util.Locale;

/**
 * Cost of the usage so far, and its linear extrapolation to the whole run.
 *
 * @param inputCost Cost of the input units consumed so far
 * @param outputCost Cost of the output units consumed so far
 * @param currentCost {@code inputCost + outputCost}
 * @param estimatedTotalCost {@code currentCost * total / processed}, 0 before the first completion
 * @param inputUnits Input units consumed so far
 * @param outputUnits Output units consumed so far
 */
public record CostEstimate(double inputCost, double outputCost, double currentCost, double estimatedTotalCost,
                           long inputUnits, long outputUnits) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "$%.2f (estimated total: $%.2f)", currentCost, estimatedTotalCost);
    }
}
