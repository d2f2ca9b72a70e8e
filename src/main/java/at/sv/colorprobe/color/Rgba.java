package at.sv.colorprobe.color;

/**
 * A color with normalized channels. Ingested probes keep all four channels in [0, 1].
 */
public record Rgba(double r, double g, double b, double a) {

    public static Rgba of(double r, double g, double b) {
        return new Rgba(r, g, b, 1.0);
    }

    @Override
    public String toString() {
        return "[" + r + "," + g + "," + b + "," + a + ']';
    }
}
