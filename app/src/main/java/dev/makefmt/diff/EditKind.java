package dev.makefmt.diff;

/**
 * Operation of a single {@link Edit}.
 */
public enum EditKind {
    /** Line present in both sequences. */
    EQUAL,
    /** Line present only in the new sequence. */
    INSERT,
    /** Line present only in the old sequence. */
    DELETE
}
