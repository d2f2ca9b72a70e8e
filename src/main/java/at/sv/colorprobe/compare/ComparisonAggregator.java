package at.sv.colorprobe.compare;

import at.sv.colorprobe.color.ChannelDeviation;
import at.sv.colorprobe.color.ColorConversion;
import at.sv.colorprobe.color.ColorDifference;
import at.sv.colorprobe.color.LabColor;
import at.sv.colorprobe.color.Rgba;
import at.sv.colorprobe.match.MatchResult;
import at.sv.colorprobe.match.PixelMatcher;
import at.sv.colorprobe.match.PixelPair;
import at.sv.colorprobe.probe.CanonicalPixel;
import at.sv.colorprobe.probe.CanonicalProbe;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the comparison points and summary statistics of aligned pixel pairs. Stateless.
 */
public final class ComparisonAggregator {

    private ComparisonAggregator() {
    }

    /**
     * Aligns the two probes and aggregates the result.
     */
    public static ComparisonResult compare(CanonicalProbe reference, CanonicalProbe test, PixelMatcher matcher,
                                           double threshold, PassCriterion passCriterion) {
        assertThreshold(threshold);
        MatchResult match = matcher.match(reference.getPixels(), test.getPixels());
        return aggregate(match, reference.getSampleCount(), test.getSampleCount(), threshold, passCriterion);
    }

    public static ComparisonResult aggregate(MatchResult match, int referenceSampleCount, int testSampleCount,
                                             double threshold, PassCriterion passCriterion) {
        assertThreshold(threshold);
        List<ComparisonPoint> points = new ArrayList<>(match.pairs().size());
        double totalDeltaE76 = 0;
        double totalDeltaE94 = 0;
        double totalDeltaE2000 = 0;
        double maxDeltaE76 = 0;
        double maxDeltaE2000 = 0;
        double maxChannelDelta = 0;
        int passCount = 0;

        for (PixelPair pair : match.pairs()) {
            ComparisonPoint point = createPoint(pair);
            totalDeltaE76 += point.deltaE76();
            totalDeltaE94 += point.deltaE94();
            totalDeltaE2000 += point.deltaE2000();
            maxDeltaE76 = Math.max(maxDeltaE76, point.deltaE76());
            maxDeltaE2000 = Math.max(maxDeltaE2000, point.deltaE2000());
            maxChannelDelta = Math.max(maxChannelDelta, point.maxChannel().value());
            if (passCriterion.passes(point, threshold)) {
                passCount++;
            }
            points.add(point);
        }

        AnalysisStats stats = AnalysisStats.EMPTY;
        int count = points.size();
        if (count > 0) {
            stats = new AnalysisStats(totalDeltaE76 / count, totalDeltaE94 / count, totalDeltaE2000 / count,
                    maxDeltaE76, maxDeltaE2000, maxChannelDelta, passCount * 100.0 / count, count);
        }
        return new ComparisonResult(match.strategy(), normalizePositions(points), stats, threshold, passCriterion,
                referenceSampleCount, testSampleCount);
    }

    private static void assertThreshold(double threshold) {
        if (!Double.isFinite(threshold) || threshold < 0) {
            throw new IllegalArgumentException("threshold must be a finite value >= 0, got " + threshold);
        }
    }

    private static ComparisonPoint createPoint(PixelPair pair) {
        CanonicalPixel reference = pair.reference();
        Rgba referenceColor = reference.rgba();
        Rgba testColor = pair.test().rgba();
        LabColor referenceLab = ColorConversion.rgbToLab(referenceColor);
        LabColor testLab = ColorConversion.rgbToLab(testColor);

        ChannelDelta channelDelta = new ChannelDelta(
                Math.abs(referenceColor.r() - testColor.r()),
                Math.abs(referenceColor.g() - testColor.g()),
                Math.abs(referenceColor.b() - testColor.b()));
        ChannelDeviation maxChannel = ColorDifference.maxChannelDeviation(referenceColor, testColor);
        String id = reference.hasIdentifier() ? reference.identifier() : "pt_" + pair.referenceIndex();

        return new ComparisonPoint(id, reference.x(), reference.y(), reference.x(), reference.y(),
                referenceColor, testColor,
                ColorDifference.deltaE76(referenceLab, testLab),
                ColorDifference.deltaE94(referenceLab, testLab),
                ColorDifference.deltaE2000(referenceLab, testLab),
                channelDelta, maxChannel);
    }

    /**
     * Rescales both axes independently into [0, 1] over the bounding box of the points. An axis without extent maps
     * to 0.5.
     */
    static List<ComparisonPoint> normalizePositions(List<ComparisonPoint> points) {
        if (points.isEmpty()) {
            return points;
        }
        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (ComparisonPoint point : points) {
            minX = Math.min(minX, point.originalX());
            maxX = Math.max(maxX, point.originalX());
            minY = Math.min(minY, point.originalY());
            maxY = Math.max(maxY, point.originalY());
        }
        double width = maxX - minX;
        double height = maxY - minY;

        List<ComparisonPoint> normalized = new ArrayList<>(points.size());
        for (ComparisonPoint point : points) {
            double x = width == 0 ? 0.5 : (point.originalX() - minX) / width;
            double y = height == 0 ? 0.5 : (point.originalY() - minY) / height;
            normalized.add(point.withNormalizedPosition(x, y));
        }
        return normalized;
    }
}
