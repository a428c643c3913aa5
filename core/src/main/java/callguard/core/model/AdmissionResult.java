package callguard.core.model;

public record AdmissionResult(
    Decision decision,
    long waitedNanos
) {
    public AdmissionResult {
        if (decision == null) throw new IllegalArgumentException("decision cannot be null");
        waitedNanos = Math.max(0L, waitedNanos);
    }

    public static AdmissionResult admitted(long waitedNanos) {
        return new AdmissionResult(Decision.ADMITTED, waitedNanos);
    }

    public static AdmissionResult timedOut(long waitedNanos) {
        return new AdmissionResult(Decision.TIMED_OUT, waitedNanos);
    }

    public static AdmissionResult saturated() {
        return new AdmissionResult(Decision.SATURATED, 0L);
    }

    public static AdmissionResult interrupted(long waitedNanos) {
        return new AdmissionResult(Decision.INTERRUPTED, waitedNanos);
    }

    public boolean admitted() {
        return decision == Decision.ADMITTED;
    }
}
