package io.predterm.service.analytics;

import java.util.List;

/**
 * Cumulative quantity within each fractional distance of mid.
 */
public record DepthProfile(List<Double> steps, List<Double> bidDepth, List<Double> askDepth) {

    public DepthProfile {
        steps = List.copyOf(steps);
        bidDepth = List.copyOf(bidDepth);
        askDepth = List.copyOf(askDepth);
    }
}
