package at.sv.colorprobe.color;

/**
 * Perceptual color differences (Delta E) between two sRGB colors, computed in CIE L*a*b*.
 * Alpha never participates in a Delta E; see {@link #maxChannelDeviation(Rgba, Rgba)} for raw channel deviations.
 */
public final class ColorDifference {

    private ColorDifference() {
    }

    // graphic arts weights
    private static final double K1 = 0.045;
    private static final double K2 = 0.015;

    private static final double POW_25_7 = 6_103_515_625.0; // 25^7

    public static double deltaE76(Rgba c1, Rgba c2) {
        return deltaE76(ColorConversion.rgbToLab(c1), ColorConversion.rgbToLab(c2));
    }

    public static double deltaE76(LabColor lab1, LabColor lab2) {
        double dL = lab1.l() - lab2.l();
        double da = lab1.a() - lab2.a();
        double db = lab1.b() - lab2.b();
        return Math.sqrt(dL * dL + da * da + db * db);
    }

    public static double deltaE94(Rgba c1, Rgba c2) {
        return deltaE94(ColorConversion.rgbToLab(c1), ColorConversion.rgbToLab(c2));
    }

    /**
     * CIE94 with kL = kC = kH = 1. The weights depend on the chroma of the first color.
     */
    public static double deltaE94(LabColor lab1, LabColor lab2) {
        double dL = lab1.l() - lab2.l();
        double C1 = lab1.chroma();
        double C2 = lab2.chroma();
        double dC = C1 - C2;
        double da = lab1.a() - lab2.a();
        double db = lab1.b() - lab2.b();
        double dH = Math.sqrt(Math.max(0.0, da * da + db * db - dC * dC));

        double sC = 1 + K1 * C1;
        double sH = 1 + K2 * C1;

        double termL = dL; // sL = 1
        double termC = dC / sC;
        double termH = dH / sH;
        return Math.sqrt(termL * termL + termC * termC + termH * termH);
    }

    public static double deltaE2000(Rgba c1, Rgba c2) {
        return deltaE2000(ColorConversion.rgbToLab(c1), ColorConversion.rgbToLab(c2));
    }

    /**
     * CIEDE2000 with kL = kC = kH = 1.
     * See: <a href="https://hajim.rochester.edu/ece/sites/gsharma/ciede2000/">Sharma, Wu, Dalal: The CIEDE2000 Color-Difference Formula</a>
     */
    public static double deltaE2000(LabColor lab1, LabColor lab2) {
        double L1 = lab1.l(), a1 = lab1.a(), b1 = lab1.b();
        double L2 = lab2.l(), a2 = lab2.a(), b2 = lab2.b();

        double cBar = (lab1.chroma() + lab2.chroma()) / 2;
        double G = 0.5 * (1 - chromaWeight(cBar));

        double a1Prime = (1 + G) * a1;
        double a2Prime = (1 + G) * a2;
        double c1Prime = Math.sqrt(a1Prime * a1Prime + b1 * b1);
        double c2Prime = Math.sqrt(a2Prime * a2Prime + b2 * b2);
        double h1Prime = hueAngle(b1, a1Prime);
        double h2Prime = hueAngle(b2, a2Prime);

        double dLPrime = L2 - L1;
        double dCPrime = c2Prime - c1Prime;
        boolean achromatic = c1Prime * c2Prime == 0;
        double dhPrime = achromatic ? 0 : hueDifference(h1Prime, h2Prime);
        double dHPrime = 2 * Math.sqrt(c1Prime * c2Prime) * Math.sin(Math.toRadians(dhPrime / 2));

        double lBarPrime = (L1 + L2) / 2;
        double cBarPrime = (c1Prime + c2Prime) / 2;
        double hBarPrime = achromatic ? h1Prime + h2Prime : meanHue(h1Prime, h2Prime);

        double T = 1
                   - 0.17 * Math.cos(Math.toRadians(hBarPrime - 30))
                   + 0.24 * Math.cos(Math.toRadians(2 * hBarPrime))
                   + 0.32 * Math.cos(Math.toRadians(3 * hBarPrime + 6))
                   - 0.20 * Math.cos(Math.toRadians(4 * hBarPrime - 63));
        double deltaTheta = 30 * Math.exp(-Math.pow((hBarPrime - 275) / 25, 2));
        double RC = 2 * chromaWeight(cBarPrime);
        double lBarMinus50Squared = (lBarPrime - 50) * (lBarPrime - 50);
        double SL = 1 + (0.015 * lBarMinus50Squared) / Math.sqrt(20 + lBarMinus50Squared);
        double SC = 1 + 0.045 * cBarPrime;
        double SH = 1 + 0.015 * cBarPrime * T;
        double RT = -Math.sin(Math.toRadians(2 * deltaTheta)) * RC;

        double termL = dLPrime / SL;
        double termC = dCPrime / SC;
        double termH = dHPrime / SH;
        return Math.sqrt(Math.max(0.0, termL * termL + termC * termC + termH * termH + RT * termC * termH));
    }

    /**
     * sqrt(C^7 / (C^7 + 25^7)), zero for achromatic input.
     */
    private static double chromaWeight(double chroma) {
        double c7 = Math.pow(chroma, 7);
        if (c7 == 0) {
            return 0;
        }
        return Math.sqrt(c7 / (c7 + POW_25_7));
    }

    /**
     * Hue angle in degrees within [0, 360), defined as 0 if both components are 0.
     */
    private static double hueAngle(double b, double aPrime) {
        if (aPrime == 0 && b == 0) {
            return 0;
        }
        double h = Math.toDegrees(Math.atan2(b, aPrime));
        return h >= 0 ? h : h + 360;
    }

    /**
     * Signed difference h2 - h1 folded into [-180, 180].
     */
    private static double hueDifference(double h1, double h2) {
        double diff = h2 - h1;
        if (Math.abs(diff) <= 180) {
            return diff;
        }
        if (diff > 180) {
            return diff - 360;
        }
        return diff + 360;
    }

    private static double meanHue(double h1, double h2) {
        double sum = h1 + h2;
        if (Math.abs(h1 - h2) <= 180) {
            return sum / 2;
        }
        if (sum < 360) {
            return (sum + 360) / 2;
        }
        return (sum - 360) / 2;
    }

    /**
     * Returns the channel with the largest absolute difference in raw (normalized RGBA) space.
     * Ties are resolved in the order R, G, B, A. Identical colors yield {@link ChannelDeviation#NONE}.
     */
    public static ChannelDeviation maxChannelDeviation(Rgba c1, Rgba c2) {
        double dr = Math.abs(c1.r() - c2.r());
        double dg = Math.abs(c1.g() - c2.g());
        double db = Math.abs(c1.b() - c2.b());
        double da = Math.abs(c1.a() - c2.a());

        double max = dr;
        Channel channel = Channel.R;
        if (dg > max) {
            max = dg;
            channel = Channel.G;
        }
        if (db > max) {
            max = db;
            channel = Channel.B;
        }
        if (da > max) {
            max = da;
            channel = Channel.A;
        }
        if (max == 0) {
            return ChannelDeviation.NONE;
        }
        return new ChannelDeviation(max, channel);
    }
}
