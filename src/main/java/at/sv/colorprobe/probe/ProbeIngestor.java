package at.sv.colorprobe.probe;

import at.sv.colorprobe.color.Rgba;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Turns loosely structured probe records into {@link CanonicalProbe}s.
 * <p>
 * Every metadata field accepts a set of alternative key names, missing optional values get defaults, pixel
 * coordinates are reconstructed from the kernel layout if absent, and 8-bit style values are scaled into [0, 1].
 * Unknown fields are ignored. The only failure is input that is not a JSON object.
 */
@Slf4j
public final class ProbeIngestor {

    public static final String UNKNOWN_PROBE = "Unknown Probe";
    public static final String UNKNOWN_HOST = "Unknown Host";
    public static final String UNKNOWN = "Unknown";
    public static final int DEFAULT_IMAGE_WIDTH = 1920;
    public static final int DEFAULT_IMAGE_HEIGHT = 1080;
    public static final double DEFAULT_POSITION = 0.5;

    private static final String[] NAME_KEYS = {"probe_name", "probeName", "plugin"};
    private static final String[] SOURCE_KEYS = {"software", "host"};
    private static final String[] FRAME_KEYS = {"frame", "frame_index", "frameIndex"};
    private static final String[] BIT_DEPTH_KEYS = {"bit_depth", "bitDepth"};
    private static final String[] COLOR_SPACE_KEYS = {"color_space", "colorSpace"};
    private static final String[] KERNEL_SIZE_KEYS = {"kernel size", "kernel_size", "kernelSize"};
    private static final String[] KERNEL_WIDTH_KEYS = {"kernel_width", "kernelWidth"};
    private static final String[] KERNEL_HEIGHT_KEYS = {"kernel_height", "kernelHeight"};
    private static final String[] IMAGE_SIZE_KEYS = {"imagesize", "imageSize", "image_size"};

    private final ObjectMapper objectMapper;
    private final Supplier<Instant> currentTime;

    public ProbeIngestor() {
        this(Instant::now);
    }

    /**
     * @param currentTime the clock used for records without any timestamp
     */
    public ProbeIngestor(Supplier<Instant> currentTime) {
        this.currentTime = currentTime;
        objectMapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public CanonicalProbe ingest(Path file) throws IOException {
        String content = Files.readString(file);
        return ingest(content);
    }

    public CanonicalProbe ingest(@Nullable String json) {
        if (json == null) {
            throw new ProbeIngestionException("Probe record is missing");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProbeIngestionException("Probe record is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return ingest(root);
    }

    public CanonicalProbe ingest(@Nullable JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ProbeIngestionException("Probe record must be a JSON object, got: " + describe(root));
        }
        String bitDepth = readText(root, UNKNOWN, BIT_DEPTH_KEYS);
        List<JsonNode> rawPixels = readPixels(root);
        KernelGrid grid = createKernelGrid(root, rawPixels);
        boolean normalize = needsNormalization(bitDepth, rawPixels);

        List<CanonicalPixel> pixels = new ArrayList<>(rawPixels.size());
        for (int i = 0; i < rawPixels.size(); i++) {
            pixels.add(toPixel(rawPixels.get(i), i, grid, normalize));
        }
        CanonicalProbe probe = CanonicalProbe.builder()
                                             .name(readText(root, UNKNOWN_PROBE, NAME_KEYS))
                                             .sourceLabel(readText(root, UNKNOWN_HOST, SOURCE_KEYS))
                                             .timestamp(readTimestamp(root))
                                             .frameIndex(readFrame(root))
                                             .bitDepthTag(bitDepth)
                                             .colorSpaceTag(readText(root, UNKNOWN, COLOR_SPACE_KEYS))
                                             .pixels(pixels)
                                             .build();
        log.debug("Ingested probe '{}' from '{}': {} pixels, kernel={}, normalized={}", probe.getName(),
                probe.getSourceLabel(), pixels.size(), grid == null ? "none" : grid.kernel(), normalize);
        return probe;
    }

    private static String describe(@Nullable JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private static List<JsonNode> readPixels(JsonNode root) {
        JsonNode pixels = root.get("pixels");
        List<JsonNode> result = new ArrayList<>();
        if (pixels != null && pixels.isArray()) {
            pixels.forEach(result::add);
        }
        return result;
    }

    private String readTimestamp(JsonNode root) {
        String timestamp = readText(root, null, "timestamp");
        if (timestamp != null) {
            return timestamp;
        }
        JsonNode time = root.get("time");
        if (time != null && time.isNumber()) {
            return Instant.ofEpochMilli(Math.round(time.doubleValue() * 1000)).toString();
        }
        return currentTime.get().toString();
    }

    private static int readFrame(JsonNode root) {
        for (String key : FRAME_KEYS) {
            JsonNode node = root.get(key);
            if (node == null || node.isNull()) {
                continue;
            }
            int frame = node.asInt(0);
            if (frame != 0) {
                return frame;
            }
        }
        return 0;
    }

    /**
     * @return the first alias holding a non-empty value, or the given default
     */
    private static String readText(JsonNode root, String defaultValue, String... keys) {
        for (String key : keys) {
            JsonNode node = root.get(key);
            if (node != null && node.isValueNode() && !node.isNull()) {
                String text = node.asText();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return defaultValue;
    }

    private static @Nullable Integer readInteger(JsonNode root, String... keys) {
        for (String key : keys) {
            JsonNode node = root.get(key);
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.isNumber()) {
                return node.intValue();
            }
            if (node.isTextual()) {
                Integer value = KernelShape.parseLeadingInteger(node.textValue());
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private static @Nullable Double readNumber(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static double readNumber(@Nullable JsonNode node, double defaultValue) {
        Double value = readNumber(node);
        return value == null ? defaultValue : value;
    }

    private static boolean hasCoordinates(JsonNode pixel) {
        return readNumber(pixel.get("x")) != null && readNumber(pixel.get("y")) != null;
    }

    private static @Nullable KernelGrid createKernelGrid(JsonNode root, List<JsonNode> rawPixels) {
        KernelShape kernel = readKernelHint(root);
        if (kernel == null && rawPixels.stream().anyMatch(pixel -> !hasCoordinates(pixel))) {
            kernel = KernelShape.infer(rawPixels.size());
            log.trace("No kernel size given, inferred {} from {} pixels", kernel, rawPixels.size());
        }
        if (kernel == null) {
            return null;
        }
        int[] imageSize = readImageSize(root);
        JsonNode position = root.get("position");
        double centerX = DEFAULT_POSITION;
        double centerY = DEFAULT_POSITION;
        if (position != null && position.isObject()) {
            centerX = readNumber(position.get("x"), DEFAULT_POSITION);
            centerY = readNumber(position.get("y"), DEFAULT_POSITION);
        }
        return KernelGrid.create(kernel, imageSize[0], imageSize[1], centerX, centerY);
    }

    private static @Nullable KernelShape readKernelHint(JsonNode root) {
        KernelShape kernel = KernelShape.parse(readText(root, null, KERNEL_SIZE_KEYS));
        if (kernel != null) {
            return kernel;
        }
        return KernelShape.of(readInteger(root, KERNEL_WIDTH_KEYS), readInteger(root, KERNEL_HEIGHT_KEYS));
    }

    /**
     * Accepts {"width": w, "height": h} or a "WxH" string. Zero or missing dimensions fall back to 1920x1080.
     */
    private static int[] readImageSize(JsonNode root) {
        for (String key : IMAGE_SIZE_KEYS) {
            JsonNode node = root.get(key);
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.isTextual()) {
                KernelShape size = KernelShape.parse(node.textValue());
                if (size != null) {
                    return new int[]{size.width(), size.height()};
                }
            } else if (node.isObject()) {
                return new int[]{
                        positiveOrDefault(readNumber(node.get("width")), DEFAULT_IMAGE_WIDTH),
                        positiveOrDefault(readNumber(node.get("height")), DEFAULT_IMAGE_HEIGHT)};
            }
        }
        return new int[]{DEFAULT_IMAGE_WIDTH, DEFAULT_IMAGE_HEIGHT};
    }

    private static int positiveOrDefault(@Nullable Double value, int defaultValue) {
        if (value == null || value.intValue() <= 0) {
            return defaultValue;
        }
        return value.intValue();
    }

    /**
     * 8-bit formats are always scaled. Otherwise the first pixel is sampled: any raw value above 1.0 means the
     * record uses the 0..255 range.
     */
    private static boolean needsNormalization(String bitDepth, List<JsonNode> rawPixels) {
        if (bitDepth.contains("8u") || bitDepth.contains("8i")) {
            return true;
        }
        if (rawPixels.isEmpty()) {
            return false;
        }
        JsonNode first = rawPixels.get(0);
        List<Double> values = new ArrayList<>();
        for (String channel : new String[]{"r", "g", "b"}) {
            Double value = readNumber(first.get(channel));
            if (value != null) {
                values.add(value);
            }
        }
        JsonNode rgba = first.get("rgba");
        if (rgba != null && rgba.isArray()) {
            rgba.forEach(element -> {
                Double value = readNumber(element);
                if (value != null) {
                    values.add(value);
                }
            });
        }
        return values.stream().anyMatch(value -> value > 1.0);
    }

    private static CanonicalPixel toPixel(JsonNode raw, int index, @Nullable KernelGrid grid, boolean normalize) {
        Rgba rgba = readColor(raw, normalize);

        Double x = readNumber(raw.get("x"));
        Double y = readNumber(raw.get("y"));
        boolean synthesized = false;
        if (x == null || y == null) {
            if (grid != null) {
                x = grid.x(index);
                y = grid.y(index);
                synthesized = true;
            } else {
                x = 0.0;
                y = 0.0;
            }
        }

        String identifier = readText(raw, null, "id");
        if (identifier == null) {
            identifier = synthesized ? grid.identifier(index) : "pt_" + index;
        }
        return new CanonicalPixel(identifier, x, y, rgba);
    }

    private static Rgba readColor(JsonNode raw, boolean normalize) {
        double r, g, b, a;
        JsonNode rgba = raw.get("rgba");
        if (rgba != null && rgba.isArray() && rgba.size() >= 3) {
            r = readNumber(rgba.get(0), 0);
            g = readNumber(rgba.get(1), 0);
            b = readNumber(rgba.get(2), 0);
            a = readNumber(rgba.get(3), 1.0);
        } else {
            r = readNumber(raw.get("r"), 0);
            g = readNumber(raw.get("g"), 0);
            b = readNumber(raw.get("b"), 0);
            a = readNumber(raw.get("a"), normalize ? 255 : 1.0);
        }
        if (normalize) {
            r /= 255;
            g /= 255;
            b /= 255;
            if (a > 1.0) {
                a /= 255;
            }
        }
        return new Rgba(clamp01(r), clamp01(g), clamp01(b), clamp01(a));
    }

    private static double clamp01(double v) {
        return v < 0 ? 0 : (v > 1 ? 1 : v);
    }
}
