package at.sv.colorprobe.match;

import at.sv.colorprobe.probe.CanonicalPixel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Aligns the pixels of a reference and a test probe.
 * <p>
 * The strategy is chosen once per pair of sequences: identifiers are preferred as long as they match at least as
 * many pixels as coordinates do, then coordinates, then plain positions if both sequences have the same length.
 * Reference pixels without a counterpart are dropped.
 */
@Slf4j
public final class PixelMatcher {

    private final DuplicateKeyPolicy duplicateKeyPolicy;

    public PixelMatcher() {
        this(DuplicateKeyPolicy.LAST_WRITE_WINS);
    }

    public PixelMatcher(DuplicateKeyPolicy duplicateKeyPolicy) {
        this.duplicateKeyPolicy = duplicateKeyPolicy;
    }

    public MatchResult match(List<CanonicalPixel> reference, List<CanonicalPixel> test) {
        KeyedLookup<String, CanonicalPixel> testById = new KeyedLookup<>(duplicateKeyPolicy);
        KeyedLookup<String, CanonicalPixel> testByCoordinate = new KeyedLookup<>(duplicateKeyPolicy);
        for (CanonicalPixel pixel : test) {
            if (pixel.hasIdentifier()) {
                testById.put(pixel.identifier(), pixel);
            }
            testByCoordinate.put(coordinateKey(pixel), pixel);
        }
        if (testById.getDuplicateCount() > 0 || testByCoordinate.getDuplicateCount() > 0) {
            log.debug("Test probe has {} duplicate identifiers and {} duplicate coordinates, resolved by {}",
                    testById.getDuplicateCount(), testByCoordinate.getDuplicateCount(), duplicateKeyPolicy);
        }

        int idMatches = 0;
        int coordinateMatches = 0;
        for (CanonicalPixel pixel : reference) {
            if (pixel.hasIdentifier() && testById.containsKey(pixel.identifier())) {
                idMatches++;
            }
            if (testByCoordinate.containsKey(coordinateKey(pixel))) {
                coordinateMatches++;
            }
        }

        MatchStrategy strategy = selectStrategy(idMatches, coordinateMatches, reference.size(), test.size());
        log.debug("Matching {} reference with {} test pixels: {} identifier and {} coordinate matches -> {}",
                reference.size(), test.size(), idMatches, coordinateMatches, strategy);
        if (strategy == MatchStrategy.NONE) {
            return MatchResult.EMPTY;
        }

        List<PixelPair> pairs = new ArrayList<>();
        for (int i = 0; i < reference.size(); i++) {
            CanonicalPixel referencePixel = reference.get(i);
            CanonicalPixel testPixel = switch (strategy) {
                case IDENTIFIER -> referencePixel.hasIdentifier() ? testById.get(referencePixel.identifier()) : null;
                case COORDINATE -> testByCoordinate.get(coordinateKey(referencePixel));
                case SEQUENTIAL -> test.get(i);
                case NONE -> null;
            };
            if (testPixel != null) {
                pairs.add(new PixelPair(i, referencePixel, testPixel));
            }
        }
        return new MatchResult(strategy, pairs);
    }

    /**
     * The alignment policy, independent of any pixel data.
     *
     * @param idMatches         reference pixels whose identifier exists in the test probe
     * @param coordinateMatches reference pixels whose coordinate key exists in the test probe
     */
    public static MatchStrategy selectStrategy(int idMatches, int coordinateMatches, int referenceSize, int testSize) {
        if (idMatches > 0 && idMatches >= coordinateMatches) {
            return MatchStrategy.IDENTIFIER;
        }
        if (coordinateMatches > 0) {
            return MatchStrategy.COORDINATE;
        }
        if (referenceSize == testSize) {
            return MatchStrategy.SEQUENTIAL;
        }
        return MatchStrategy.NONE;
    }

    /**
     * Coordinates quantized to five decimal places, e.g. "0.50000_0.25000".
     */
    public static String coordinateKey(CanonicalPixel pixel) {
        return String.format(Locale.ROOT, "%.5f_%.5f", pixel.x(), pixel.y());
    }
}
