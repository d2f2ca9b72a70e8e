package at.sv.colorprobe.compare;

/**
 * The Delta E metric a comparison point has to keep at or below the threshold to pass.
 */
public enum PassCriterion {
    DELTA_E_2000 {
        @Override
        public double metric(ComparisonPoint point) {
            return point.deltaE2000();
        }
    },
    /**
     * Legacy mode of older reports.
     */
    DELTA_E_76 {
        @Override
        public double metric(ComparisonPoint point) {
            return point.deltaE76();
        }
    };

    public abstract double metric(ComparisonPoint point);

    public boolean passes(ComparisonPoint point, double threshold) {
        return metric(point) <= threshold;
    }
}
