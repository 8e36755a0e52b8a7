package io.macroq.error;

public final class WorldAbortedException extends RuntimeException {
    public WorldAbortedException(String message) {
        super(message);
    }

    public WorldAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
