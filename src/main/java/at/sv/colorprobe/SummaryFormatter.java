package at.sv.colorprobe;

import at.sv.colorprobe.compare.AnalysisStats;
import at.sv.colorprobe.compare.ComparisonPoint;
import at.sv.colorprobe.compare.ComparisonResult;
import at.sv.colorprobe.compare.ErrorHistogram;
import at.sv.colorprobe.probe.CanonicalProbe;

import java.util.Locale;

public final class SummaryFormatter {
    private SummaryFormatter() {
    }

    public static String format(ComparisonResult result, CanonicalProbe reference, CanonicalProbe test,
                                int worstPoints) {
        StringBuilder sb = new StringBuilder();
        line(sb, "Reference: %s", describe(reference));
        line(sb, "Test:      %s", describe(test));
        line(sb, "Matched by %s", result.strategy());
        if (!result.hasIntersection()) {
            line(sb, "No matching pixels (reference: %d samples, test: %d samples)",
                    result.referenceSampleCount(), result.testSampleCount());
            return sb.toString();
        }
        AnalysisStats stats = result.stats();
        line(sb, "Samples:         %d", stats.sampleCount());
        line(sb, "Avg dE (2000):   %s", formatDeltaE(stats.avgDeltaE2000()));
        line(sb, "Max dE (2000):   %s", formatDeltaE(stats.maxDeltaE2000()));
        line(sb, "Avg dE (94):     %s", formatDeltaE(stats.avgDeltaE94()));
        line(sb, "Avg dE (76):     %s", formatDeltaE(stats.avgDeltaE76()));
        line(sb, "Max dE (76):     %s", formatDeltaE(stats.maxDeltaE76()));
        line(sb, "Max Ch Diff:     %s", formatDeltaE(stats.maxChannelDelta()));
        line(sb, "Pass rate:       %s%% (%s <= %s)", formatPercent(stats.passRate()), result.passCriterion(),
                formatNumber(result.threshold()));

        line(sb, "Error distribution (dE 2000):");
        for (ErrorHistogram.Bin bin : result.histogram().bins()) {
            line(sb, "  %-8s %d", bin.label(), bin.count());
        }

        if (worstPoints > 0) {
            line(sb, "Worst points:");
            for (ComparisonPoint point : result.worstPoints(worstPoints)) {
                line(sb, "  %s dE2000=%s dE94=%s dE76=%s max=%s %s", point.id(), formatDeltaE(point.deltaE2000()),
                        formatDeltaE(point.deltaE94()), formatDeltaE(point.deltaE76()),
                        point.maxChannel().channel(), formatDeltaE(point.maxChannel().value()));
            }
        }
        return sb.toString();
    }

    private static String describe(CanonicalProbe probe) {
        return String.format(Locale.ROOT, "%s (%s, frame %d, %s, %s, %d samples)", probe.getName(),
                probe.getSourceLabel(), probe.getFrameIndex(), probe.getBitDepthTag(), probe.getColorSpaceTag(),
                probe.getSampleCount());
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.ROOT, format, args)).append(System.lineSeparator());
    }

    public static String formatDeltaE(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    /**
     * Pass rate with one decimal, e.g. "33.3" or "100".
     */
    public static String formatPercent(double passRate) {
        String formatted = String.format(Locale.ROOT, "%.1f", passRate);
        if (formatted.endsWith(".0")) {
            return formatted.substring(0, formatted.length() - 2);
        }
        return formatted;
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return String.format(Locale.ROOT, "%.1f", value);
        }
        return String.valueOf(value);
    }
}
