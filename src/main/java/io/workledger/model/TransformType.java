package io.workledger.model;

public enum TransformType {
    EVENT_STREAMING,
    STAGE_IN,
    ACTIVE_LEARNING,
    HYPER_PARAMETER_OPT,
    DERIVATION,
    OTHER
}
