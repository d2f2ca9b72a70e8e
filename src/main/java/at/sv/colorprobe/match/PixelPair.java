package at.sv.colorprobe.match;

import at.sv.colorprobe.probe.CanonicalPixel;

/**
 * A reference pixel and its test counterpart.
 *
 * @param referenceIndex position of the reference pixel within its probe
 */
public record PixelPair(int referenceIndex, CanonicalPixel reference, CanonicalPixel test) {
}
