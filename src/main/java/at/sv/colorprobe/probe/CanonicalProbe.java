package at.sv.colorprobe.probe;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One ingested measurement record. Instances are immutable and get replaced as a whole when a probe is loaded again.
 */
@Data
public final class CanonicalProbe {

    private final String name;
    private final String sourceLabel;
    private final String timestamp;
    private final int frameIndex;
    private final String bitDepthTag;
    private final String colorSpaceTag;
    private final List<CanonicalPixel> pixels;

    @Builder
    private CanonicalProbe(String name, String sourceLabel, String timestamp, int frameIndex, String bitDepthTag,
                           String colorSpaceTag, List<CanonicalPixel> pixels) {
        this.name = name;
        this.sourceLabel = sourceLabel;
        this.timestamp = timestamp;
        this.frameIndex = frameIndex;
        this.bitDepthTag = bitDepthTag;
        this.colorSpaceTag = colorSpaceTag;
        this.pixels = pixels == null ? List.of() : List.copyOf(pixels);
    }

    public int getSampleCount() {
        return pixels.size();
    }
}
