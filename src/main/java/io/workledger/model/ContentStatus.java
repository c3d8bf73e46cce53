package io.workledger.model;

public enum ContentStatus {
    NEW,
    PROCESSING,
    AVAILABLE,
    FAILED,
    FINAL_FAILED,
    LOST,
    DELETED
}
