package at.sv.colorprobe.match;

/**
 * How reference and test pixels were paired.
 */
public enum MatchStrategy {
    /**
     * Pixels with equal identifiers.
     */
    IDENTIFIER,
    /**
     * Pixels whose coordinates agree to five decimal places.
     */
    COORDINATE,
    /**
     * Pixels at the same position of equally long sequences.
     */
    SEQUENTIAL,
    /**
     * Nothing could be paired.
     */
    NONE
}
