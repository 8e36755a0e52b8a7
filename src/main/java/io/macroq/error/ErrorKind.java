package io.macroq.error;

public enum ErrorKind {
    CONFIGURATION,
    SCHEDULING_INVARIANT,
    PAYLOAD_EXECUTION,
    SERIALIZATION
}
