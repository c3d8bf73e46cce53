package io.workledger.model;

public enum ContentType {
    /** Whole file; identity ignores min/max ids. */
    FILE,
    /** Sub-range of a file, addressed by min/max ids. */
    EVENT,
    PSEUDO_CONTENT
}
