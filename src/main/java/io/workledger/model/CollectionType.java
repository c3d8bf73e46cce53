package io.workledger.model;

public enum CollectionType {
    CONTAINER,
    DATASET,
    FILE
}
