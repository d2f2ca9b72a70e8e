package at.sv.colorprobe.match;

/**
 * Decides which pixel a lookup keeps if several test pixels share an identifier or coordinate key.
 */
public enum DuplicateKeyPolicy {
    /**
     * The pixel seen last in iteration order replaces earlier ones. This is the established behaviour.
     */
    LAST_WRITE_WINS,
    FIRST_WRITE_WINS
}
