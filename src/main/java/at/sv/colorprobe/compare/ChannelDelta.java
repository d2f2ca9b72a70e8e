package at.sv.colorprobe.compare;

/**
 * Absolute per-channel differences of the color channels.
 */
public record ChannelDelta(double r, double g, double b) {
}
