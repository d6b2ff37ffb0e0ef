package com.energysentinel.job;

import com.energysentinel.core.error.DataValidationException;
import com.energysentinel.core.error.DatabaseConnectionException;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.Measurement;
import com.energysentinel.core.model.TimeSeriesWindow;
import com.energysentinel.core.store.StoreStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CsvTimeSeriesStore}.
 */
class CsvTimeSeriesStoreTest {

    private static final String HEADER =
            "Datetime,Global_active_power,Global_reactive_power,Voltage,Global_intensity,"
                    + "Sub_metering_1,Sub_metering_2,Sub_metering_3\n";

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should parse every column and treat '?' and empty cells as missing")
    void shouldParseColumns() throws IOException {
        CsvTimeSeriesStore store = storeWith(HEADER
                + "2024-03-01 00:00:00,1.42,0.11,234.8,6.0,0.0,1.0,17.0\n"
                + "2024-03-01 01:00:00,?,0.10,,5.8,0.0,?,16.0\n");

        TimeSeriesWindow window = store.getWindow(LocalDateTime.of(2024, 3, 1, 0, 0), LocalDateTime.of(2024, 3, 2, 0, 0));

        assertThat(window.size()).isEqualTo(2);
        EnergyReading first = window.get(0);
        assertThat(first.getActivePower()).isEqualTo(1.42);
        assertThat(first.get(Measurement.REACTIVE_POWER)).isEqualTo(0.11);
        assertThat(first.getVoltage()).isEqualTo(234.8);
        assertThat(first.getCurrent()).isEqualTo(6.0);
        assertThat(first.get(Measurement.SUB_METER_3)).isEqualTo(17.0);
        EnergyReading second = window.get(1);
        assertThat(second.getActivePower()).isNull();
        assertThat(second.getVoltage()).isNull();
        assertThat(second.get(Measurement.SUB_METER_2)).isNull();
        assertThat(second.get(Measurement.SUB_METER_3)).isEqualTo(16.0);
    }

    @Test
    @DisplayName("Should sort rows, keep the last duplicate and filter by an inclusive range")
    void shouldSortAndFilter() throws IOException {
        CsvTimeSeriesStore store = storeWith(HEADER
                + "2024-03-01 02:00:00,3.0,,,,,,\n"
                + "2024-03-01 00:00:00,1.0,,,,,,\n"
                + "2024-03-01 01:00:00,2.0,,,,,,\n"
                + "2024-03-01 01:00:00,2.5,,,,,,\n"
                + "2024-03-01 03:00:00,4.0,,,,,,\n");

        TimeSeriesWindow window = store.getWindow(LocalDateTime.of(2024, 3, 1, 1, 0), LocalDateTime.of(2024, 3, 1, 2, 0));

        assertThat(window.getReadings()).extracting(EnergyReading::getActivePower).containsExactly(2.5, 3.0);
    }

    @Test
    @DisplayName("Should accept ISO-8601 timestamps and files without sub-metering columns")
    void shouldAcceptIsoTimestamps() throws IOException {
        CsvTimeSeriesStore store = storeWith("Datetime,Global_active_power,Voltage\n"
                + "2024-03-01T00:00:00,1.0,230.0\n"
                + "2024-03-01T00:01,1.1,231.0\n");

        StoreStats stats = store.getStats();

        assertThat(stats.getTotalRecords()).isEqualTo(2);
        assertThat(stats.getFirstTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
        assertThat(stats.getLastTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 1));
    }

    @Test
    @DisplayName("Should measure recent readings back from the newest row")
    void shouldReturnRecentReadings() throws IOException {
        StringBuilder csv = new StringBuilder(HEADER);
        for (int hour = 0; hour < 48; hour++) {
            csv.append(String.format("2024-03-%02d %02d:00:00,1.0,,230.0,,,,%n", 1 + hour / 24, hour % 24));
        }
        CsvTimeSeriesStore store = storeWith(csv.toString());

        TimeSeriesWindow recent = store.getRecent(5);

        assertThat(recent.size()).isEqualTo(6);
        assertThat(recent.getStart()).isEqualTo(LocalDateTime.of(2024, 3, 2, 18, 0));
        assertThat(recent.getEnd()).isEqualTo(LocalDateTime.of(2024, 3, 2, 23, 0));
    }

    @Test
    @DisplayName("Should report empty statistics for a header-only file")
    void shouldReportEmptyStats() throws IOException {
        CsvTimeSeriesStore store = storeWith(HEADER);

        assertThat(store.getStats().isEmpty()).isTrue();
        assertThat(store.getRecent(24).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should fail the connection test and raise a connection error when the file is missing")
    void shouldFailOnMissingFile() {
        CsvTimeSeriesStore store = new CsvTimeSeriesStore(dir.resolve("absent.csv"));

        assertThat(store.testConnection()).isFalse();
        assertThatThrownBy(store::getStats)
                .isInstanceOf(DatabaseConnectionException.class)
                .hasMessageContaining("absent.csv");
    }

    @Test
    @DisplayName("Should pass the connection test for a readable file")
    void shouldPassConnectionTest() throws IOException {
        assertThat(storeWith(HEADER).testConnection()).isTrue();
    }

    @Test
    @DisplayName("Should treat NaN and infinite values as missing readings")
    void shouldTreatNonFiniteAsMissing() throws IOException {
        CsvTimeSeriesStore store = storeWith(HEADER
                + "2024-03-01 00:00:00,NaN,Infinity,-Infinity,6.0,,,\n");

        EnergyReading reading = store.getRecent(1).get(0);

        assertThat(reading.getActivePower()).isNull();
        assertThat(reading.get(Measurement.REACTIVE_POWER)).isNull();
        assertThat(reading.getVoltage()).isNull();
        assertThat(reading.getCurrent()).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Should name the line of an unparseable value")
    void shouldRejectBadValue() throws IOException {
        CsvTimeSeriesStore store = storeWith(HEADER
                + "2024-03-01 00:00:00,1.0,,,,,,\n"
                + "2024-03-01 01:00:00,abc,,,,,,\n");

        assertThatThrownBy(store::getStats)
                .isInstanceOf(DataValidationException.class)
                .hasMessage("Line 3: invalid Global_active_power 'abc'");
    }

    @Test
    @DisplayName("Should reject a row without a timestamp")
    void shouldRejectMissingTimestamp() throws IOException {
        CsvTimeSeriesStore store = storeWith(HEADER + ",1.0,,,,,,\n");

        assertThatThrownBy(store::getStats)
                .isInstanceOf(DataValidationException.class)
                .hasMessage("Line 2: missing Datetime");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private CsvTimeSeriesStore storeWith(String content) throws IOException {
        Path file = dir.resolve("readings.csv");
        Files.writeString(file, content);
        return new CsvTimeSeriesStore(file);
    }
}
