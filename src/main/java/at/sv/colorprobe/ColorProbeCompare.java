package at.sv.colorprobe;

import at.sv.colorprobe.compare.ComparisonResult;
import at.sv.colorprobe.compare.ComparisonSession;
import at.sv.colorprobe.compare.PassCriterion;
import at.sv.colorprobe.match.DuplicateKeyPolicy;
import at.sv.colorprobe.match.PixelMatcher;
import at.sv.colorprobe.probe.CanonicalProbe;
import at.sv.colorprobe.probe.DemoProbeGenerator;
import at.sv.colorprobe.probe.ProbeIngestionException;
import at.sv.colorprobe.probe.ProbeIngestor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Random;

@Command(name = "ColorProbeCompare", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Compares the sampled pixels of a reference and a test probe using CIE Delta E metrics.")
public final class ColorProbeCompare implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ColorProbeCompare.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "REFERENCE_FILE",
            description = "The JSON probe file produced by the reference engine.")
    Path referenceFile;
    @Parameters(
            index = "1",
            arity = "0..1",
            paramLabel = "TEST_FILE",
            description = "The JSON probe file produced by the engine under test.")
    Path testFile;
    @Option(names = "--threshold", paramLabel = "<deltaE>",
            defaultValue = "${env:THRESHOLD:-1.0}",
            description = "The Delta E value a sample may not exceed to pass. Default: ${DEFAULT-VALUE}")
    double threshold;
    @Option(names = "--pass-metric", paramLabel = "<metric>",
            defaultValue = "${env:PASS_METRIC:-DELTA_E_2000}",
            description = "The metric compared against the threshold: ${COMPLETION-CANDIDATES}. " +
                          "DELTA_E_76 reproduces older reports. Default: ${DEFAULT-VALUE}")
    PassCriterion passCriterion;
    @Option(names = "--worst-points", paramLabel = "<count>",
            defaultValue = "${env:WORST_POINTS:-5}",
            description = "The number of samples with the highest Delta E 2000 to list. Default: ${DEFAULT-VALUE}")
    int worstPoints;
    @Option(names = "--duplicate-keys", paramLabel = "<policy>",
            defaultValue = "${env:DUPLICATE_KEY_POLICY:-LAST_WRITE_WINS}",
            description = "Which test sample is used if several share an id or coordinate: ${COMPLETION-CANDIDATES}." +
                          " Default: ${DEFAULT-VALUE}")
    DuplicateKeyPolicy duplicateKeyPolicy;
    @Option(names = "--demo",
            defaultValue = "false",
            description = "Compare two generated 9x9 gradient probes instead of files.")
    boolean demo;
    @Option(names = "--demo-variance", paramLabel = "<variance>",
            defaultValue = "${env:DEMO_VARIANCE:-0.05}",
            description = "The noise added to the generated test probe. Default: ${DEFAULT-VALUE}")
    double demoVariance;
    @Option(names = "--seed",
            defaultValue = "${env:SEED:-42}",
            description = "The seed for the generated noise. Default: ${DEFAULT-VALUE}")
    long seed;

    private ProbeIngestor ingestor;
    private ComparisonResult lastResult;

    public static void main(String[] args) {
        int execute = new CommandLine(new ColorProbeCompare()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        ingestor = new ProbeIngestor();
        ComparisonSession session = new ComparisonSession(ingestor, new PixelMatcher(duplicateKeyPolicy),
                result -> lastResult = result);
        session.setThreshold(threshold);
        session.setPassCriterion(passCriterion);

        MDC.put("context", "ingest");
        CanonicalProbe reference;
        CanonicalProbe test;
        if (demo) {
            DemoProbeGenerator generator = new DemoProbeGenerator(new Random(seed), Instant::now);
            reference = ingestor.ingest(generator.generate("REF", 0.0));
            test = ingestor.ingest(generator.generate("TEST", demoVariance));
        } else {
            reference = readProbe(referenceFile);
            test = readProbe(testFile);
        }

        MDC.put("context", "compare");
        session.setReference(reference);
        session.setTest(test);

        PrintWriter out = spec.commandLine().getOut();
        out.print(SummaryFormatter.format(lastResult, session.getReference().orElseThrow(),
                session.getTest().orElseThrow(), worstPoints));
        out.flush();
    }

    private CanonicalProbe readProbe(Path file) {
        try {
            return ingestor.ingest(file);
        } catch (ProbeIngestionException e) {
            LOG.error("Failed to read probe file '{}': {}", file, e.getLocalizedMessage());
            throw new ProbeIngestionException("Invalid probe file '" + file + "': " + e.getLocalizedMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void assertConfigurationParameters() {
        if (!Double.isFinite(threshold) || threshold < 0) {
            fail("--threshold must be >= 0");
        }
        if (worstPoints < 0) {
            fail("--worst-points must be >= 0");
        }
        if (demo) {
            if (demoVariance < 0) {
                fail("--demo-variance must be >= 0");
            }
            return;
        }
        if (referenceFile == null || testFile == null) {
            fail("REFERENCE_FILE and TEST_FILE are required unless --demo is set");
        }
        assertInputIsReadable(referenceFile);
        assertInputIsReadable(testFile);
    }

    private void assertInputIsReadable(Path file) {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            fail("Given probe file '" + file.toAbsolutePath() + "' does not exist, is not a file or is not readable!");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
