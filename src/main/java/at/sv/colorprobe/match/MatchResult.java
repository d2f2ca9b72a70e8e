package at.sv.colorprobe.match;

import java.util.List;

/**
 * The aligned pixel pairs, in reference order, together with the strategy that produced them.
 */
public record MatchResult(MatchStrategy strategy, List<PixelPair> pairs) {

    public static final MatchResult EMPTY = new MatchResult(MatchStrategy.NONE, List.of());

    public MatchResult {
        pairs = List.copyOf(pairs);
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }
}
