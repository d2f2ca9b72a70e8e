package at.sv.colorprobe.probe;

import at.sv.colorprobe.color.Rgba;
import org.jetbrains.annotations.Nullable;

/**
 * A single sampled pixel after ingestion. Coordinates are in the probe's own (usually normalized image) space.
 */
public record CanonicalPixel(@Nullable String identifier, double x, double y, Rgba rgba) {

    public CanonicalPixel(double x, double y, Rgba rgba) {
        this(null, x, y, rgba);
    }

    public boolean hasIdentifier() {
        return identifier != null && !identifier.isEmpty();
    }
}
