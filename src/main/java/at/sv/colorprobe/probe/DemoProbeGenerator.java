package at.sv.colorprobe.probe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Creates raw probe records of a 9x9 red/green gradient, optionally with uniform noise, for demos and smoke tests.
 */
public final class DemoProbeGenerator {

    public static final int GRID_SIZE = 9;
    public static final String PROBE_NAME = "ColorProbe_Test_01";
    public static final int FRAME = 1001;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Random random;
    private final Supplier<Instant> currentTime;

    /**
     * @param random the noise source, seed it for reproducible records
     */
    public DemoProbeGenerator(Random random, Supplier<Instant> currentTime) {
        this.random = random;
        this.currentTime = currentTime;
    }

    /**
     * @param variance the total width of the uniform noise added to each color channel, 0 for a clean gradient
     */
    public ObjectNode generate(String software, double variance) {
        if (variance < 0) {
            throw new IllegalArgumentException("variance must be >= 0, got " + variance);
        }
        ArrayNode pixels = objectMapper.createArrayNode();
        for (int i = 0; i < GRID_SIZE; i++) {
            for (int j = 0; j < GRID_SIZE; j++) {
                double r = (double) i / GRID_SIZE;
                double g = (double) j / GRID_SIZE;
                double b = 0.5;

                ObjectNode pixel = pixels.addObject();
                pixel.put("id", "pt_" + i + "_" + j);
                pixel.put("x", (i + 0.5) / GRID_SIZE);
                pixel.put("y", (j + 0.5) / GRID_SIZE);
                pixel.putArray("rgba")
                     .add(noisy(r, variance))
                     .add(noisy(g, variance))
                     .add(noisy(b, variance))
                     .add(1.0);
            }
        }

        ObjectNode probe = objectMapper.createObjectNode();
        probe.put("probe_name", PROBE_NAME);
        probe.put("software", software);
        probe.put("timestamp", currentTime.get().toString());
        probe.put("frame", FRAME);
        probe.put("bit_depth", "32f");
        probe.put("color_space", "Linear");
        probe.set("pixels", pixels);
        return probe;
    }

    private double noisy(double value, double variance) {
        if (variance == 0) {
            return value;
        }
        double noise = (random.nextDouble() - 0.5) * variance;
        return Math.max(0, Math.min(1, value + noise));
    }
}
