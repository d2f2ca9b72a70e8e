package at.sv.colorprobe.compare;

import at.sv.colorprobe.match.PixelMatcher;
import at.sv.colorprobe.probe.CanonicalProbe;
import at.sv.colorprobe.probe.ProbeIngestor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the reference and the test probe plus the pass/fail settings, and recomputes the comparison whenever one of
 * them changes.
 * <p>
 * Inputs are kept as one immutable snapshot. A result is only published, and only returned by {@link #getResult()},
 * while the snapshot it was computed from is still the current one, so concurrent triggers never expose a stale
 * comparison. Listener notifications are serialized and skipped for superseded results, so the last notification
 * always carries the current result. A failed load leaves both probes and the last result untouched.
 */
@Slf4j
public final class ComparisonSession {

    public static final double DEFAULT_THRESHOLD = 1.0;

    private final ProbeIngestor ingestor;
    private final PixelMatcher matcher;
    private final ComparisonListener listener;
    private final AtomicReference<Inputs> inputs;
    private final AtomicReference<Published> published = new AtomicReference<>();
    private final Object notificationMutex = new Object();

    public ComparisonSession(ProbeIngestor ingestor, PixelMatcher matcher, ComparisonListener listener) {
        this.ingestor = ingestor;
        this.matcher = matcher;
        this.listener = listener;
        inputs = new AtomicReference<>(new Inputs(null, null, DEFAULT_THRESHOLD, PassCriterion.DELTA_E_2000));
    }

    /**
     * @throws at.sv.colorprobe.probe.ProbeIngestionException if the record cannot be read, the session is unchanged then
     */
    public CanonicalProbe loadReference(String json) {
        CanonicalProbe probe = ingestor.ingest(json);
        setReference(probe);
        return probe;
    }

    /**
     * @throws at.sv.colorprobe.probe.ProbeIngestionException if the record cannot be read, the session is unchanged then
     */
    public CanonicalProbe loadTest(String json) {
        CanonicalProbe probe = ingestor.ingest(json);
        setTest(probe);
        return probe;
    }

    public void setReference(CanonicalProbe reference) {
        update(current -> current.withReference(reference));
    }

    public void setTest(CanonicalProbe test) {
        update(current -> current.withTest(test));
    }

    public void setThreshold(double threshold) {
        if (!Double.isFinite(threshold) || threshold < 0) {
            throw new IllegalArgumentException("threshold must be a finite value >= 0, got " + threshold);
        }
        update(current -> current.withThreshold(threshold));
    }

    public void setPassCriterion(PassCriterion passCriterion) {
        update(current -> current.withPassCriterion(passCriterion));
    }

    /**
     * Removes both probes and the last result, keeping threshold and pass criterion.
     */
    public void clear() {
        update(current -> new Inputs(null, null, current.threshold(), current.passCriterion()));
    }

    public Optional<CanonicalProbe> getReference() {
        return Optional.ofNullable(inputs.get().reference());
    }

    public Optional<CanonicalProbe> getTest() {
        return Optional.ofNullable(inputs.get().test());
    }

    public double getThreshold() {
        return inputs.get().threshold();
    }

    public PassCriterion getPassCriterion() {
        return inputs.get().passCriterion();
    }

    /**
     * @return the comparison of the current inputs, empty while a probe is missing
     */
    public Optional<ComparisonResult> getResult() {
        Published current = published.get();
        if (current == null || current.inputs() != inputs.get()) {
            return Optional.empty();
        }
        return Optional.of(current.result());
    }

    /**
     * Recomputes the comparison of the current inputs. Called automatically on every change.
     *
     * @return the new result, or empty if a probe is missing or the inputs changed in the meantime
     */
    public Optional<ComparisonResult> recompute() {
        Inputs snapshot = inputs.get();
        if (!snapshot.isComplete()) {
            published.updateAndGet(previous -> inputs.get() == snapshot ? null : previous);
            return Optional.empty();
        }
        ComparisonResult result = ComparisonAggregator.compare(snapshot.reference(), snapshot.test(), matcher,
                snapshot.threshold(), snapshot.passCriterion());
        Published candidate = new Published(snapshot, result);
        Published current = published.updateAndGet(previous -> inputs.get() == snapshot ? candidate : previous);
        if (current != candidate) {
            log.debug("Discarding comparison of superseded inputs");
            return Optional.empty();
        }
        synchronized (notificationMutex) {
            // a newer recompute may have published since, its notification must stay the last one
            if (published.get() != candidate || inputs.get() != snapshot) {
                log.debug("Skipping notification of superseded comparison");
                return Optional.empty();
            }
            logResult(snapshot, result);
            listener.onComparisonUpdated(result);
        }
        return Optional.of(result);
    }

    private void update(UnaryOperator<Inputs> change) {
        inputs.updateAndGet(change);
        recompute();
    }

    private static void logResult(Inputs snapshot, ComparisonResult result) {
        if (!result.hasIntersection()) {
            log.warn("No matching pixels between reference '{}' ({} samples) and test '{}' ({} samples)",
                    snapshot.reference().getName(), result.referenceSampleCount(),
                    snapshot.test().getName(), result.testSampleCount());
            return;
        }
        AnalysisStats stats = result.stats();
        log.info("Compared {} samples by {}: avg dE2000={}, max dE2000={}, pass rate {}% at {} <= {}",
                stats.sampleCount(), result.strategy(), stats.avgDeltaE2000(), stats.maxDeltaE2000(),
                stats.passRate(), result.passCriterion(), result.threshold());
    }

    private record Inputs(@Nullable CanonicalProbe reference, @Nullable CanonicalProbe test, double threshold,
                          PassCriterion passCriterion) {

        boolean isComplete() {
            return reference != null && test != null;
        }

        Inputs withReference(CanonicalProbe reference) {
            return new Inputs(reference, test, threshold, passCriterion);
        }

        Inputs withTest(CanonicalProbe test) {
            return new Inputs(reference, test, threshold, passCriterion);
        }

        Inputs withThreshold(double threshold) {
            return new Inputs(reference, test, threshold, passCriterion);
        }

        Inputs withPassCriterion(PassCriterion passCriterion) {
            return new Inputs(reference, test, threshold, passCriterion);
        }
    }

    private record Published(Inputs inputs, ComparisonResult result) {
    }
}
