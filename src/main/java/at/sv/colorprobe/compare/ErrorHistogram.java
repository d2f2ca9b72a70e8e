package at.sv.colorprobe.compare;

import java.util.ArrayList;
import java.util.List;

/**
 * Distribution of Delta E 2000 values over fixed bins: [0, 0.5), [0.5, 1), [1, 2), [2, 5), [5, 10), [10, inf).
 */
public record ErrorHistogram(List<Bin> bins) {

    private static final double[] BOUNDS = {0, 0.5, 1.0, 2.0, 5.0, 10.0};
    private static final String[] LABELS = {"0-0.5", "0.5-1", "1-2", "2-5", "5-10", "10->"};

    public record Bin(String label, double lowerBound, double upperBound, int count) {
    }

    public ErrorHistogram {
        bins = List.copyOf(bins);
    }

    public static ErrorHistogram of(List<ComparisonPoint> points) {
        int[] counts = new int[BOUNDS.length];
        for (ComparisonPoint point : points) {
            int bin = binIndex(point.deltaE2000());
            if (bin >= 0) {
                counts[bin]++;
            }
        }
        List<Bin> bins = new ArrayList<>(BOUNDS.length);
        for (int i = 0; i < BOUNDS.length; i++) {
            double upper = i + 1 < BOUNDS.length ? BOUNDS[i + 1] : Double.POSITIVE_INFINITY;
            bins.add(new Bin(LABELS[i], BOUNDS[i], upper, counts[i]));
        }
        return new ErrorHistogram(bins);
    }

    private static int binIndex(double deltaE) {
        for (int i = BOUNDS.length - 1; i >= 0; i--) {
            if (deltaE >= BOUNDS[i]) {
                return i;
            }
        }
        return -1;
    }

    public int totalCount() {
        return bins.stream().mapToInt(Bin::count).sum();
    }
}
