package com.energysentinel.core.quality;

import com.energysentinel.core.config.QualitySettings;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.QualityReport;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Validates a raw window before any training or detection runs on it.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>coverage (whole days between first and last reading) below the minimum
 * invalidates the window</li>
 * <li>more than the allowed percentage of missing active-power readings
 * invalidates the window</li>
 * <li>mean voltage or maximum power outside the expected range, and gaps
 * longer than the warning threshold, are reported as warnings only</li>
 * </ul>
 *
 * <p>
 * {@link #check(TimeSeriesWindow)} never throws for a non-null window; callers
 * branch on {@link QualityReport#isValid()}.
 * </p>
 *
 * @since 1.0.0
 */
public class DataQualityGate {

    private static final Logger LOG = LoggerFactory.getLogger(DataQualityGate.class);

    private final QualitySettings settings;

    public DataQualityGate(QualitySettings settings) {
        this.settings = Objects.requireNonNull(settings, "QualitySettings must not be null");
    }

    /**
     * Compute the quality report of a window.
     *
     * @param window the raw window; must not be {@code null}
     * @return the report
     */
    public QualityReport check(TimeSeriesWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        QualityReport.Builder report = QualityReport.builder().dataPoints(window.size());

        if (window.isEmpty()) {
            LOG.warn("Quality gate received an empty window");
            return report.valid(false)
                    .nullPercentage(100.0)
                    .warning("Window contains no readings")
                    .build();
        }

        long coverageDays = window.span().toDays();
        double maxGapHours = window.maxGap().toSeconds() / 3600.0;

        int missingPower = 0;
        double powerMax = Double.NEGATIVE_INFINITY;
        double voltageSum = 0;
        int voltageCount = 0;
        for (EnergyReading reading : window) {
            Double power = reading.getActivePower();
            if (power == null) {
                missingPower++;
            } else {
                powerMax = Math.max(powerMax, power);
            }
            Double voltage = reading.getVoltage();
            if (voltage != null) {
                voltageSum += voltage;
                voltageCount++;
            }
        }
        double nullPercentage = 100.0 * missingPower / window.size();
        double meanVoltage = voltageCount == 0 ? Double.NaN : voltageSum / voltageCount;
        double maxPower = missingPower == window.size() ? Double.NaN : powerMax;

        boolean voltageOk = !Double.isNaN(meanVoltage)
                && meanVoltage >= settings.getMinVoltage() && meanVoltage <= settings.getMaxVoltage();
        boolean powerOk = !Double.isNaN(maxPower)
                && maxPower >= settings.getMinPower() && maxPower <= settings.getMaxPower();

        boolean valid = true;
        if (coverageDays < settings.getMinCoverageDays()) {
            valid = false;
            report.warning(String.format("Insufficient coverage: %d days (minimum %d)",
                    coverageDays, settings.getMinCoverageDays()));
        }
        if (nullPercentage > settings.getMaxNullPercentage()) {
            valid = false;
            report.warning(String.format("Too many missing power readings: %.2f%% (maximum %.2f%%)",
                    nullPercentage, settings.getMaxNullPercentage()));
        }
        if (!voltageOk) {
            report.warning(String.format("Mean voltage %.1f V outside [%.1f, %.1f]",
                    meanVoltage, settings.getMinVoltage(), settings.getMaxVoltage()));
        }
        if (!powerOk) {
            report.warning(String.format("Maximum power %.2f kW outside [%.2f, %.2f]",
                    maxPower, settings.getMinPower(), settings.getMaxPower()));
        }
        if (maxGapHours > settings.getGapWarningHours()) {
            report.warning(String.format("Largest gap %.1f h exceeds %.1f h", maxGapHours,
                    settings.getGapWarningHours()));
        }

        QualityReport result = report.valid(valid)
                .coverageDays(coverageDays)
                .nullPercentage(nullPercentage)
                .meanVoltage(meanVoltage)
                .maxPower(maxPower)
                .voltageOk(voltageOk)
                .powerOk(powerOk)
                .maxGapHours(maxGapHours)
                .build();

        if (valid) {
            LOG.info("Quality gate passed: {} points, {} days coverage, {}% missing",
                    window.size(), coverageDays, String.format("%.2f", nullPercentage));
        } else {
            LOG.warn("Quality gate failed: {}", result.getWarnings());
        }
        return result;
    }
}
