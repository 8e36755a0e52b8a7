package io.macroq.error;

public class SchedulerException extends RuntimeException {
    private final ErrorKind kind;

    public SchedulerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SchedulerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static SchedulerException configuration(String message) {
        return new SchedulerException(ErrorKind.CONFIGURATION, message);
    }

    public static SchedulerException invariant(String message) {
        return new SchedulerException(ErrorKind.SCHEDULING_INVARIANT, message);
    }

    public static SchedulerException payload(String message, Throwable cause) {
        return new SchedulerException(ErrorKind.PAYLOAD_EXECUTION, message, cause);
    }

    public static SchedulerException serialization(String message) {
        return new SchedulerException(ErrorKind.SERIALIZATION, message);
    }

    public static SchedulerException serialization(String message, Throwable cause) {
        return new SchedulerException(ErrorKind.SERIALIZATION, message, cause);
    }
}
