package io.workledger.model;

public enum RequestType {
    EVENT_STREAMING,
    STAGE_IN,
    ACTIVE_LEARNING,
    HYPER_PARAMETER_OPT,
    DERIVATION,
    OTHER
}
