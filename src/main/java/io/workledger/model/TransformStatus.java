package io.workledger.model;

public enum TransformStatus {
    NEW,
    READY,
    TRANSFORMING,
    FINISHED,
    SUB_FINISHED,
    FAILED,
    EXTEND,
    TO_CANCEL,
    CANCELLING,
    CANCELLED
}
