package at.sv.colorprobe.color;

/**
 * The largest absolute per-channel difference between two colors.
 */
public record ChannelDeviation(double value, Channel channel) {

    public static final ChannelDeviation NONE = new ChannelDeviation(0.0, Channel.NONE);
}
