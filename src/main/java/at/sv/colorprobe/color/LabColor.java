package at.sv.colorprobe.color;

/**
 * CIE L*a*b* color relative to the D65 white point.
 */
public record LabColor(double l, double a, double b) {

    public double chroma() {
        return Math.sqrt(a * a + b * b);
    }
}
