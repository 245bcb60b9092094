package dev.dapbridge.client;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Reason carried by a {@code stopped} event. Debuggers are free to send reasons beyond the ones
 * named here, so this is an open value rather than an enum.
 */
public final class StopReason {

    public static final StopReason BREAKPOINT = new StopReason("breakpoint");
    public static final StopReason STEP = new StopReason("step");
    public static final StopReason PAUSE = new StopReason("pause");
    public static final StopReason EXCEPTION = new StopReason("exception");
    public static final StopReason ENTRY = new StopReason("entry");

    private static final Set<StopReason> KNOWN = Set.of(BREAKPOINT, STEP, PAUSE, EXCEPTION, ENTRY);

    private final String value;

    private StopReason(String value) {
        this.value = value;
    }

    @JsonCreator
    public static StopReason of(String value) {
        String normalized = value == null || value.isBlank() ? "unknown" : value.trim().toLowerCase(Locale.ROOT);
        return new StopReason(normalized);
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isKnown() {
        return KNOWN.contains(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof StopReason other && value.equals(other.value));
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
