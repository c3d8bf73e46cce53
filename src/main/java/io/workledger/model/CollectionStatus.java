package io.workledger.model;

public enum CollectionStatus {
    NEW,
    UPDATED,
    PROCESSING,
    OPEN,
    CLOSED,
    SUB_CLOSED,
    FAILED,
    DELETED
}
