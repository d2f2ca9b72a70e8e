package at.sv.colorprobe.color;

/**
 * sRGB (normalized, D65) to CIE XYZ to CIE L*a*b*.
 * <p>
 * Inputs outside [0, 1] are not guarded and propagate through the formulas as they are.
 */
public final class ColorConversion {

    private ColorConversion() {
    }

    // sRGB (linear, scaled to 100) -> XYZ
    private static final double M11 = 0.4124, M12 = 0.3576, M13 = 0.1805;
    private static final double M21 = 0.2126, M22 = 0.7152, M23 = 0.0722;
    private static final double M31 = 0.0193, M32 = 0.1192, M33 = 0.9505;

    // D65 reference white
    private static final double WHITE_X = 95.047;
    private static final double WHITE_Y = 100.0;
    private static final double WHITE_Z = 108.883;

    private static final double LAB_EPSILON = 0.008856;
    private static final double LAB_KAPPA_SLOPE = 7.787;
    private static final double LAB_OFFSET = 16.0 / 116.0;

    public static LabColor rgbToLab(Rgba color) {
        return rgbToLab(color.r(), color.g(), color.b());
    }

    public static LabColor rgbToLab(double r, double g, double b) {
        double[] XYZ = rgbToXYZ(r, g, b);
        return XYZToLab(XYZ[0], XYZ[1], XYZ[2]);
    }

    /**
     * @return XYZ with the reference white at Y = 100
     */
    public static double[] rgbToXYZ(double r, double g, double b) {
        double red = GammaCorrection.sRGBToLinear(r) * 100.0;
        double green = GammaCorrection.sRGBToLinear(g) * 100.0;
        double blue = GammaCorrection.sRGBToLinear(b) * 100.0;

        double X = M11 * red + M12 * green + M13 * blue;
        double Y = M21 * red + M22 * green + M23 * blue;
        double Z = M31 * red + M32 * green + M33 * blue;
        return new double[]{X, Y, Z};
    }

    public static LabColor XYZToLab(double X, double Y, double Z) {
        double x = labCompanding(X / WHITE_X);
        double y = labCompanding(Y / WHITE_Y);
        double z = labCompanding(Z / WHITE_Z);

        double L = 116.0 * y - 16.0;
        double a = 500.0 * (x - y);
        double b = 200.0 * (y - z);
        return new LabColor(L, a, b);
    }

    private static double labCompanding(double t) {
        if (t > LAB_EPSILON) {
            return Math.cbrt(t);
        }
        return LAB_KAPPA_SLOPE * t + LAB_OFFSET;
    }

    private static final class GammaCorrection {
        private static final double gamma = 2.4;
        private static final double transition = 0.04045; // encoded domain
        private static final double slope = 12.92;
        private static final double offset = 0.055;

        static double sRGBToLinear(double value) {
            if (value <= transition) {
                return value / slope;
            }
            return Math.pow((value + offset) / (1 + offset), gamma);
        }
    }
}
