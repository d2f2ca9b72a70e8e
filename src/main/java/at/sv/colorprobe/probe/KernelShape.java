package at.sv.colorprobe.probe;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Width and height of a sampled pixel neighbourhood, e.g. "3x3".
 */
public record KernelShape(int width, int height) {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^[+-]?\\d+");

    public KernelShape {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Kernel dimensions must be > 0, got " + width + "x" + height);
        }
    }

    /**
     * Parses a "WxH" hint. Each part is read as a leading integer, so "5 x 3px" is accepted as well.
     *
     * @return the parsed shape, or null if the hint is not a usable "WxH" value
     */
    public static @Nullable KernelShape parse(@Nullable String hint) {
        if (hint == null) {
            return null;
        }
        String[] parts = hint.toLowerCase(Locale.ROOT).split("x", -1);
        if (parts.length < 2) {
            return null;
        }
        Integer width = parseLeadingInteger(parts[0]);
        Integer height = parseLeadingInteger(parts[1]);
        return of(width, height);
    }

    /**
     * @return the shape for positive dimensions, otherwise null
     */
    public static @Nullable KernelShape of(@Nullable Integer width, @Nullable Integer height) {
        if (width == null || height == null || width <= 0 || height <= 0) {
            return null;
        }
        return new KernelShape(width, height);
    }

    /**
     * A square kernel if the pixel count is a perfect square, otherwise a single row holding all pixels.
     */
    public static KernelShape infer(int pixelCount) {
        if (pixelCount <= 0) {
            throw new IllegalArgumentException("Cannot infer a kernel for " + pixelCount + " pixels");
        }
        int side = (int) Math.round(Math.sqrt(pixelCount));
        if (side * side == pixelCount) {
            return new KernelShape(side, side);
        }
        return new KernelShape(pixelCount, 1);
    }

    static @Nullable Integer parseLeadingInteger(String value) {
        Matcher matcher = LEADING_INTEGER.matcher(value.trim());
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
