package at.sv.colorprobe.color;

/**
 * Color channels in tie-break priority order. {@link #NONE} designates "no deviation at all".
 */
public enum Channel {
    R,
    G,
    B,
    A,
    NONE
}
