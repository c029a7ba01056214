package io.tfb.api.log;

/**
 * Result of re-scoping a logger to a test directory or binding it to a transcript file.
 * <p>
 * Both operations are best effort: a failure leaves the logger writing to the
 * console only, and is reported here rather than thrown.
 *
 * @param status whether the logger state was changed
 * @param reason why the operation was skipped, empty when applied
 */
public record LogBinding(Status status, String reason) {

    public enum Status {
        APPLIED,
        SKIPPED
    }

    private static final LogBinding APPLIED = new LogBinding(Status.APPLIED, "");

    public LogBinding {
        if (status == null) {
            throw new IllegalArgumentException("Status must not be null");
        }
        if (reason == null) {
            reason = "";
        }
        if (status == Status.SKIPPED && reason.isBlank()) {
            throw new IllegalArgumentException("A skipped binding needs a reason");
        }
    }

    public static LogBinding applied() {
        return APPLIED;
    }

    public static LogBinding skipped(String reason) {
        return new LogBinding(Status.SKIPPED, reason);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
