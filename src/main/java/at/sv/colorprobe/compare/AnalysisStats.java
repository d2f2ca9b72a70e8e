package at.sv.colorprobe.compare;

/**
 * Summary of a comparison.
 *
 * @param passRate    percentage [0, 100] of points passing the threshold
 * @param sampleCount number of aligned points
 */
public record AnalysisStats(double avgDeltaE76, double avgDeltaE94, double avgDeltaE2000,
                            double maxDeltaE76, double maxDeltaE2000, double maxChannelDelta,
                            double passRate, int sampleCount) {

    public static final AnalysisStats EMPTY = new AnalysisStats(0, 0, 0, 0, 0, 0, 0, 0);
}
