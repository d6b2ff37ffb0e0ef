package com.energysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of the data quality gate for one window.
 *
 * <p>
 * {@code valid} gates every downstream stage. Range violations and large
 * gaps only appear in {@link #getWarnings()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class QualityReport {

    private final boolean valid;
    private final int dataPoints;
    private final long coverageDays;
    private final double nullPercentage;
    private final double meanVoltage;
    private final double maxPower;
    private final boolean voltageOk;
    private final boolean powerOk;
    private final double maxGapHours;
    private final List<String> warnings;

    private QualityReport(Builder b) {
        this.valid = b.valid;
        this.dataPoints = b.dataPoints;
        this.coverageDays = b.coverageDays;
        this.nullPercentage = b.nullPercentage;
        this.meanVoltage = b.meanVoltage;
        this.maxPower = b.maxPower;
        this.voltageOk = b.voltageOk;
        this.powerOk = b.powerOk;
        this.maxGapHours = b.maxGapHours;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(b.warnings));
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("is_valid")
    public boolean isValid() {
        return valid;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    public long getCoverageDays() {
        return coverageDays;
    }

    public double getNullPercentage() {
        return nullPercentage;
    }

    public double getMeanVoltage() {
        return meanVoltage;
    }

    public double getMaxPower() {
        return maxPower;
    }

    @JsonProperty("voltage_ok")
    public boolean isVoltageOk() {
        return voltageOk;
    }

    @JsonProperty("power_ok")
    public boolean isPowerOk() {
        return powerOk;
    }

    public double getMaxGapHours() {
        return maxGapHours;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public static final class Builder {
        private boolean valid;
        private int dataPoints;
        private long coverageDays;
        private double nullPercentage;
        private double meanVoltage = Double.NaN;
        private double maxPower = Double.NaN;
        private boolean voltageOk;
        private boolean powerOk;
        private double maxGapHours;
        private final List<String> warnings = new ArrayList<>();

        public Builder valid(boolean v) {
            this.valid = v;
            return this;
        }

        public Builder dataPoints(int v) {
            this.dataPoints = v;
            return this;
        }

        public Builder coverageDays(long v) {
            this.coverageDays = v;
            return this;
        }

        public Builder nullPercentage(double v) {
            this.nullPercentage = v;
            return this;
        }

        public Builder meanVoltage(double v) {
            this.meanVoltage = v;
            return this;
        }

        public Builder maxPower(double v) {
            this.maxPower = v;
            return this;
        }

        public Builder voltageOk(boolean v) {
            this.voltageOk = v;
            return this;
        }

        public Builder powerOk(boolean v) {
            this.powerOk = v;
            return this;
        }

        public Builder maxGapHours(double v) {
            this.maxGapHours = v;
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public QualityReport build() {
            return new QualityReport(this);
        }
    }

    @Override
    public String toString() {
        return "QualityReport{" +
                "valid=" + valid +
                ", dataPoints=" + dataPoints +
                ", coverageDays=" + coverageDays +
                ", nullPercentage=" + String.format("%.2f", nullPercentage) +
                ", maxGapHours=" + String.format("%.2f", maxGapHours) +
                ", warnings=" + warnings +
                '}';
    }
}
