package at.sv.colorprobe.compare;

/**
 * Receives every comparison result a {@link ComparisonSession} publishes.
 */
public interface ComparisonListener {

    void onComparisonUpdated(ComparisonResult result);
}
