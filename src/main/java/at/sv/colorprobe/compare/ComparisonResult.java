package at.sv.colorprobe.compare;

import at.sv.colorprobe.match.MatchStrategy;

import java.util.Comparator;
import java.util.List;

/**
 * Everything a recompute produces. Lists are unmodifiable.
 *
 * @param referenceSampleCount pixels in the reference probe, to diagnose empty intersections
 * @param testSampleCount      pixels in the test probe, to diagnose empty intersections
 */
public record ComparisonResult(MatchStrategy strategy, List<ComparisonPoint> comparisonPoints, AnalysisStats stats,
                               double threshold, PassCriterion passCriterion,
                               int referenceSampleCount, int testSampleCount) {

    public static final int REPORT_WORST_POINTS = 5;

    public ComparisonResult {
        comparisonPoints = List.copyOf(comparisonPoints);
    }

    public boolean hasIntersection() {
        return !comparisonPoints.isEmpty();
    }

    public boolean passes(ComparisonPoint point) {
        return passCriterion.passes(point, threshold);
    }

    /**
     * The {@code limit} points with the highest Delta E 2000, highest first. Equal values keep their reference order.
     */
    public List<ComparisonPoint> worstPoints(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        return comparisonPoints.stream()
                               .sorted(Comparator.comparingDouble(ComparisonPoint::deltaE2000).reversed())
                               .limit(limit)
                               .toList();
    }

    public ErrorHistogram histogram() {
        return ErrorHistogram.of(comparisonPoints);
    }
}
