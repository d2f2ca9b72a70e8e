package at.sv.colorprobe.probe;

/**
 * Signals that a raw probe record could not be read as structured data at all. No partial probe is produced.
 */
public final class ProbeIngestionException extends RuntimeException {

    public ProbeIngestionException(String message) {
        super(message);
    }

    public ProbeIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
