package dev.makefmt.parser;

/**
 * Kind-specific attributes of a {@link Node}. Each node kind carries exactly one implementation.
 */
public interface NodeFields {

    /**
     * Returns an equal instance that shares no storage with this one.
     */
    NodeFields copy();
}
