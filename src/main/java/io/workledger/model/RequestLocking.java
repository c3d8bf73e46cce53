package io.workledger.model;

public enum RequestLocking {
    IDLE,
    LOCKING
}
