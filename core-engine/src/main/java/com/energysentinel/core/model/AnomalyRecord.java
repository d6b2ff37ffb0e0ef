package com.energysentinel.core.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A consensus anomaly produced by one detection pass.
 *
 * <p>
 * Records are transient: the engine hands them to the notification layer and
 * never persists them. Use the {@link Builder}; {@code timestamp} and
 * {@code type} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRecord {

    /** Severity first (critical before low), then chronological. */
    public static final Comparator<AnomalyRecord> BY_SEVERITY_THEN_TIME = Comparator
            .comparing(AnomalyRecord::getSeverity)
            .thenComparing(AnomalyRecord::getTimestamp);

    private final LocalDateTime timestamp;
    private final double value;
    private final Set<DetectorKind> methodVotes;
    private final AnomalyType type;

    private AnomalyRecord(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.value = builder.value;
        this.methodVotes = builder.methodVotes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.methodVotes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocalDateTime timestamp;
        private double value;
        private Set<DetectorKind> methodVotes = Collections.emptySet();
        private AnomalyType type;

        public Builder timestamp(LocalDateTime timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder methodVotes(Set<DetectorKind> methodVotes) {
            this.methodVotes = Objects.requireNonNull(methodVotes, "methodVotes must not be null");
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /** Active power reading (kW) at the anomalous timestamp. */
    public double getValue() {
        return value;
    }

    public Set<DetectorKind> getMethodVotes() {
        return methodVotes;
    }

    public AnomalyType getType() {
        return type;
    }

    public Severity getSeverity() {
        return type.getSeverity();
    }

    public String getDescription() {
        return type.getDescription();
    }

    public String getAction() {
        return type.getAction();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return timestamp.equals(that.timestamp) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, type);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "timestamp=" + timestamp +
                ", value=" + value +
                ", type=" + type +
                ", severity=" + getSeverity() +
                ", methodVotes=" + methodVotes +
                '}';
    }
}
