package at.sv.colorprobe.probe;

import at.sv.colorprobe.color.Rgba;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProbeIngestorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private ProbeIngestor ingestor;

    @BeforeEach
    void setUp() {
        ingestor = new ProbeIngestor(() -> NOW);
    }

    @Test
    void ingest_fullRecord_readsMetadataAndPixels() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "probe_name": "ColorProbe_Test_01",
                  "software": "REF",
                  "timestamp": "2024-05-01T10:00:00Z",
                  "frame": 1001,
                  "bit_depth": "32f",
                  "color_space": "Linear",
                  "pixels": [
                    {"id": "a", "x": 0.25, "y": 0.75, "rgba": [0.1, 0.2, 0.3, 0.4]},
                    {"id": "b", "x": 0.5, "y": 0.5, "r": 0.5, "g": 0.6, "b": 0.7}
                  ]
                }
                """);

        assertThat(probe.getName()).isEqualTo("ColorProbe_Test_01");
        assertThat(probe.getSourceLabel()).isEqualTo("REF");
        assertThat(probe.getTimestamp()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(probe.getFrameIndex()).isEqualTo(1001);
        assertThat(probe.getBitDepthTag()).isEqualTo("32f");
        assertThat(probe.getColorSpaceTag()).isEqualTo("Linear");
        assertThat(probe.getPixels()).containsExactly(
                new CanonicalPixel("a", 0.25, 0.75, new Rgba(0.1, 0.2, 0.3, 0.4)),
                new CanonicalPixel("b", 0.5, 0.5, new Rgba(0.5, 0.6, 0.7, 1.0)));
    }

    @Test
    void ingest_alternativeKeys() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "plugin": "Probe OFX",
                  "host": "Nuke",
                  "frame_index": 12,
                  "bitDepth": "16f",
                  "colorSpace": "ACEScg",
                  "pixels": []
                }
                """);

        assertThat(probe.getName()).isEqualTo("Probe OFX");
        assertThat(probe.getSourceLabel()).isEqualTo("Nuke");
        assertThat(probe.getFrameIndex()).isEqualTo(12);
        assertThat(probe.getBitDepthTag()).isEqualTo("16f");
        assertThat(probe.getColorSpaceTag()).isEqualTo("ACEScg");
    }

    @Test
    void ingest_emptyObject_defaults() {
        CanonicalProbe probe = ingestor.ingest("{}");

        assertThat(probe.getName()).isEqualTo(ProbeIngestor.UNKNOWN_PROBE);
        assertThat(probe.getSourceLabel()).isEqualTo(ProbeIngestor.UNKNOWN_HOST);
        assertThat(probe.getTimestamp()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(probe.getFrameIndex()).isZero();
        assertThat(probe.getBitDepthTag()).isEqualTo(ProbeIngestor.UNKNOWN);
        assertThat(probe.getColorSpaceTag()).isEqualTo(ProbeIngestor.UNKNOWN);
        assertThat(probe.getPixels()).isEmpty();
        assertThat(probe.getSampleCount()).isZero();
    }

    @Test
    void ingest_emptyName_usesNextAliasOrDefault() {
        CanonicalProbe probe = ingestor.ingest("""
                {"probe_name": "", "probeName": "Second"}
                """);

        assertThat(probe.getName()).isEqualTo("Second");
    }

    @Test
    void ingest_epochTime_convertedToTimestamp() {
        CanonicalProbe probe = ingestor.ingest("""
                {"time": 1700000000}
                """);

        assertThat(probe.getTimestamp()).isEqualTo("2023-11-14T22:13:20Z");
    }

    @Test
    void ingest_pixelsNotAnArray_noPixels() {
        assertThat(ingestor.ingest("""
                {"pixels": {"x": 1}}
                """).getPixels()).isEmpty();
    }

    @Test
    void ingest_invalidJson_throwsException() {
        assertThatThrownBy(() -> ingestor.ingest("{\"pixels\": ["))
                .isInstanceOf(ProbeIngestionException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void ingest_trailingContent_throwsException() {
        assertThatThrownBy(() -> ingestor.ingest("{\"pixels\": []} xyz"))
                .isInstanceOf(ProbeIngestionException.class)
                .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> ingestor.ingest("{} {}"))
                .isInstanceOf(ProbeIngestionException.class);
    }

    @Test
    void ingest_nullOrBlank_throwsException() {
        assertThatThrownBy(() -> ingestor.ingest((String) null))
                .isInstanceOf(ProbeIngestionException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> ingestor.ingest(""))
                .isInstanceOf(ProbeIngestionException.class);
    }

    @Test
    void ingest_arrayRoot_throwsException() {
        assertThatThrownBy(() -> ingestor.ingest("[1, 2, 3]"))
                .isInstanceOf(ProbeIngestionException.class)
                .hasMessageContaining("array");
    }

    @Test
    void ingest_8BitDepth_scalesValues() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "bit_depth": "8u",
                  "pixels": [{"x": 0, "y": 0, "r": 128, "g": 0, "b": 255}]
                }
                """);

        Rgba rgba = probe.getPixels().get(0).rgba();
        assertThat(rgba.r()).isCloseTo(0.50196, within(1e-5));
        assertThat(rgba.g()).isZero();
        assertThat(rgba.b()).isEqualTo(1.0);
        assertThat(rgba.a()).isEqualTo(1.0);
    }

    @Test
    void ingest_8BitDepth_smallValues_stillScaled() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "bit_depth": "8u",
                  "pixels": [{"x": 0, "y": 0, "rgba": [1, 1, 1, 1]}]
                }
                """);

        Rgba rgba = probe.getPixels().get(0).rgba();
        assertThat(rgba.r()).isCloseTo(1 / 255.0, within(1e-9));
        assertThat(rgba.a()).isEqualTo(1.0);
    }

    @Test
    void ingest_valuesAboveOne_detectedAs8Bit() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "bit_depth": "32f",
                  "pixels": [
                    {"x": 0, "y": 0, "rgba": [255, 51, 0, 255]},
                    {"x": 1, "y": 0, "rgba": [0.5, 0.5, 0.5, 1]}
                  ]
                }
                """);

        assertThat(probe.getPixels().get(0).rgba().r()).isEqualTo(1.0);
        assertThat(probe.getPixels().get(0).rgba().g()).isCloseTo(0.2, within(1e-9));
        assertThat(probe.getPixels().get(0).rgba().a()).isEqualTo(1.0);
        // the decision is made once per record
        assertThat(probe.getPixels().get(1).rgba().r()).isCloseTo(0.5 / 255, within(1e-9));
    }

    @Test
    void ingest_outOfRangeValues_clamped() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "pixels": [{"x": 0, "y": 0, "rgba": [-0.2, 0.5, 0.5, 1]}]
                }
                """);

        assertThat(probe.getPixels().get(0).rgba()).isEqualTo(new Rgba(0.0, 0.5, 0.5, 1.0));
    }

    @Test
    void ingest_missingChannels_defaultToZero() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "pixels": [{"x": 0, "y": 0, "g": 0.5}]
                }
                """);

        assertThat(probe.getPixels().get(0).rgba()).isEqualTo(new Rgba(0.0, 0.5, 0.0, 1.0));
    }

    @Test
    void ingest_pixelsWithCoordinatesWithoutId_positionalIds() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "pixels": [
                    {"x": 0.1, "y": 0.2, "rgba": [0, 0, 0, 1]},
                    {"x": 0.3, "y": 0.4, "rgba": [0, 0, 0, 1]}
                  ]
                }
                """);

        assertThat(probe.getPixels()).extracting(CanonicalPixel::identifier).containsExactly("pt_0", "pt_1");
        assertThat(probe.getPixels().get(1).x()).isEqualTo(0.3);
        assertThat(probe.getPixels().get(1).y()).isEqualTo(0.4);
    }

    @Test
    void ingest_kernelSize_synthesizesCoordinatesAroundPosition() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "kernel size": "3x3",
                  "imagesize": {"width": 100, "height": 50},
                  "position": {"x": 0.5, "y": 0.5},
                  "pixels": %s
                }
                """.formatted(colorsOnly(9)));

        List<CanonicalPixel> pixels = probe.getPixels();
        assertThat(pixels).hasSize(9);
        assertPixel(pixels.get(0), "k0_r0_c0", 0.49, 0.48);
        assertPixel(pixels.get(4), "k4_r1_c1", 0.5, 0.5);
        assertPixel(pixels.get(5), "k5_r1_c2", 0.51, 0.5);
        assertPixel(pixels.get(8), "k8_r2_c2", 0.51, 0.52);
    }

    @Test
    void ingest_kernelWidthAndHeight_imageSizeString() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "kernel_width": 2,
                  "kernel_height": "1",
                  "image_size": "200x100",
                  "position": {"x": 0.25, "y": 0.75},
                  "pixels": %s
                }
                """.formatted(colorsOnly(2)));

        assertPixel(probe.getPixels().get(0), "k0_r0_c0", 0.25 - 0.5 / 200, 0.75);
        assertPixel(probe.getPixels().get(1), "k1_r0_c1", 0.25 + 0.5 / 200, 0.75);
    }

    @Test
    void ingest_noKernelHint_perfectSquare_inferredSquareKernel() {
        CanonicalProbe probe = ingestor.ingest("""
                {"pixels": %s}
                """.formatted(colorsOnly(9)));

        // default 1920x1080 image, centered
        assertPixel(probe.getPixels().get(0), "k0_r0_c0", 0.5 - 1 / 1920.0, 0.5 - 1 / 1080.0);
        assertPixel(probe.getPixels().get(4), "k4_r1_c1", 0.5, 0.5);
    }

    @Test
    void ingest_noKernelHint_otherCount_inferredSingleRow() {
        CanonicalProbe probe = ingestor.ingest("""
                {"pixels": %s}
                """.formatted(colorsOnly(7)));

        assertPixel(probe.getPixels().get(6), "k6_r0_c6", 0.5 + 3 / 1920.0, 0.5);
    }

    @Test
    void ingest_someCoordinatesMissing_onlyMissingOnesSynthesized() {
        CanonicalProbe probe = ingestor.ingest("""
                {
                  "pixels": [
                    {"x": 0.1, "y": 0.2, "rgba": [0, 0, 0, 1]},
                    {"rgba": [0, 0, 0, 1]},
                    {"id": "named", "rgba": [0, 0, 0, 1]}
                  ]
                }
                """);

        assertPixel(probe.getPixels().get(0), "pt_0", 0.1, 0.2);
        assertPixel(probe.getPixels().get(1), "k1_r0_c1", 0.5, 0.5);
        assertPixel(probe.getPixels().get(2), "named", 0.5 + 1 / 1920.0, 0.5);
    }

    @Test
    void ingest_invalidKernelHint_fallsBackToInference() {
        CanonicalProbe probe = ingestor.ingest("""
                {"kernel size": "0x3", "pixels": %s}
                """.formatted(colorsOnly(4)));

        assertPixel(probe.getPixels().get(3), "k3_r1_c1", 0.5 + 0.5 / 1920.0, 0.5 + 0.5 / 1080.0);
    }

    @Test
    void ingest_file(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("probe.json");
        Files.writeString(file, """
                {"probeName": "From file", "pixels": [{"id": "p", "x": 1, "y": 1, "rgba": [1, 1, 1, 1]}]}
                """);

        CanonicalProbe probe = ingestor.ingest(file);

        assertThat(probe.getName()).isEqualTo("From file");
        assertThat(probe.getSampleCount()).isEqualTo(1);
    }

    private static String colorsOnly(int count) {
        return IntStream.range(0, count)
                        .mapToObj(i -> "{\"rgba\": [0.5, 0.5, 0.5, 1.0]}")
                        .collect(Collectors.joining(",", "[", "]"));
    }

    private static void assertPixel(CanonicalPixel pixel, String identifier, double x, double y) {
        assertThat(pixel.identifier()).isEqualTo(identifier);
        assertThat(pixel.x()).isCloseTo(x, within(1e-9));
        assertThat(pixel.y()).isCloseTo(y, within(1e-9));
    }
}
