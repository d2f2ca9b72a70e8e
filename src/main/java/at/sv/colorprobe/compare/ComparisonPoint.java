package at.sv.colorprobe.compare;

import at.sv.colorprobe.color.ChannelDeviation;
import at.sv.colorprobe.color.Rgba;

/**
 * The comparison of one aligned pixel pair.
 *
 * @param normalizedX x rescaled into [0, 1] over the bounding box of all matched points
 * @param normalizedY y rescaled into [0, 1] over the bounding box of all matched points
 * @param originalX   x of the reference pixel
 * @param originalY   y of the reference pixel
 */
public record ComparisonPoint(String id,
                              double normalizedX, double normalizedY,
                              double originalX, double originalY,
                              Rgba referenceColor, Rgba testColor,
                              double deltaE76, double deltaE94, double deltaE2000,
                              ChannelDelta channelDelta,
                              ChannelDeviation maxChannel) {

    ComparisonPoint withNormalizedPosition(double x, double y) {
        return new ComparisonPoint(id, x, y, originalX, originalY, referenceColor, testColor,
                deltaE76, deltaE94, deltaE2000, channelDelta, maxChannel);
    }
}
