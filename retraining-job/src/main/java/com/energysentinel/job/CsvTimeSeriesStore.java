package com.energysentinel.job;

import com.energysentinel.core.error.DataValidationException;
import com.energysentinel.core.error.DatabaseConnectionException;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.Measurement;
import com.energysentinel.core.model.TimeSeriesWindow;
import com.energysentinel.core.store.StoreStats;
import com.energysentinel.core.store.TimeSeriesStore;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link TimeSeriesStore} over a CSV export of the {@code energy_readings}
 * table, for local and offline runs.
 *
 * <h3>Format</h3>
 * <p>
 * Comma separated with a header row using the household power consumption
 * column names:
 * </p>
 *
 * <pre>
 * Datetime,Global_active_power,Global_reactive_power,Voltage,Global_intensity,Sub_metering_1,Sub_metering_2,Sub_metering_3
 * 2024-03-01 00:00:00,1.42,0.11,234.8,6.0,0.0,1.0,17.0
 * </pre>
 *
 * <p>
 * {@code Datetime} is required and accepts {@code yyyy-MM-dd HH:mm:ss} or
 * ISO-8601. Measurement columns may be absent; empty cells, {@code ?} and
 * non-finite numbers ({@code NaN}, {@code Infinity}) are missing readings.
 * Rows are sorted by timestamp and a repeated timestamp keeps the last row.
 * </p>
 *
 * <p>
 * The file is re-read on every call so a scheduler always sees the latest
 * export. "Recent" is measured back from the newest reading in the file,
 * not from the wall clock.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvTimeSeriesStore implements TimeSeriesStore {

    private static final Logger LOG = LoggerFactory.getLogger(CsvTimeSeriesStore.class);

    public static final String DATETIME_COLUMN = "Datetime";

    private static final DateTimeFormatter SQL_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Map<Measurement, String> COLUMNS = new EnumMap<>(Measurement.class);

    static {
        COLUMNS.put(Measurement.ACTIVE_POWER, "Global_active_power");
        COLUMNS.put(Measurement.REACTIVE_POWER, "Global_reactive_power");
        COLUMNS.put(Measurement.VOLTAGE, "Voltage");
        COLUMNS.put(Measurement.CURRENT, "Global_intensity");
        COLUMNS.put(Measurement.SUB_METER_1, "Sub_metering_1");
        COLUMNS.put(Measurement.SUB_METER_2, "Sub_metering_2");
        COLUMNS.put(Measurement.SUB_METER_3, "Sub_metering_3");
    }

    private final Path file;
    private final CsvMapper mapper;

    public CsvTimeSeriesStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    // ---------------------------------------------------------------
    // TimeSeriesStore
    // ---------------------------------------------------------------

    @Override
    public TimeSeriesWindow getWindow(LocalDateTime start, LocalDateTime end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            return TimeSeriesWindow.empty();
        }
        NavigableMap<LocalDateTime, EnergyReading> readings = readAll();
        return TimeSeriesWindow.of(new ArrayList<>(readings.subMap(start, true, end, true).values()));
    }

    @Override
    public TimeSeriesWindow getRecent(int hours) {
        if (hours < 1) {
            throw new IllegalArgumentException("hours must be >= 1, got: " + hours);
        }
        NavigableMap<LocalDateTime, EnergyReading> readings = readAll();
        if (readings.isEmpty()) {
            return TimeSeriesWindow.empty();
        }
        LocalDateTime newest = readings.lastKey();
        return TimeSeriesWindow.of(new ArrayList<>(readings.tailMap(newest.minusHours(hours), true).values()));
    }

    @Override
    public StoreStats getStats() {
        NavigableMap<LocalDateTime, EnergyReading> readings = readAll();
        if (readings.isEmpty()) {
            return StoreStats.empty();
        }
        return new StoreStats(readings.size(), readings.firstKey(), readings.lastKey());
    }

    @Override
    public boolean testConnection() {
        boolean readable = Files.isRegularFile(file) && Files.isReadable(file);
        if (!readable) {
            LOG.warn("Data file {} is not readable", file);
        }
        return readable;
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    private NavigableMap<LocalDateTime, EnergyReading> readAll() {
        if (!testConnection()) {
            throw new DatabaseConnectionException("Data file not readable: " + file);
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        NavigableMap<LocalDateTime, EnergyReading> readings = new TreeMap<>();
        int duplicates = 0;
        try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(file.toFile())) {
            int line = 1;
            while (rows.hasNext()) {
                line++;
                EnergyReading reading = toReading(rows.next(), line);
                if (readings.put(reading.getTimestamp(), reading) != null) {
                    duplicates++;
                }
            }
        } catch (IOException e) {
            throw new DatabaseConnectionException("Cannot read data file " + file + ": " + e.getMessage(), e);
        }
        if (duplicates > 0) {
            LOG.warn("{} duplicate timestamps in {}, kept the last row of each", duplicates, file);
        }
        LOG.debug("Read {} readings from {}", readings.size(), file);
        return readings;
    }

    private static EnergyReading toReading(Map<String, String> row, int line) {
        String rawTimestamp = row.get(DATETIME_COLUMN);
        if (rawTimestamp == null || rawTimestamp.isBlank()) {
            throw new DataValidationException("Line " + line + ": missing " + DATETIME_COLUMN);
        }
        EnergyReading.Builder builder = EnergyReading.builder(parseTimestamp(rawTimestamp.trim(), line));
        for (Map.Entry<Measurement, String> column : COLUMNS.entrySet()) {
            builder.set(column.getKey(), parseValue(row.get(column.getValue()), column.getValue(), line));
        }
        return builder.build();
    }

    static LocalDateTime parseTimestamp(String value, int line) {
        try {
            return value.indexOf('T') >= 0
                    ? LocalDateTime.parse(value)
                    : LocalDateTime.parse(value, SQL_DATETIME);
        } catch (DateTimeParseException e) {
            throw new DataValidationException("Line " + line + ": invalid " + DATETIME_COLUMN + " '" + value + "'", e);
        }
    }

    static Double parseValue(String value, String column, int line) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || "?".equals(trimmed)) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(trimmed);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            throw new DataValidationException("Line " + line + ": invalid " + column + " '" + value + "'", e);
        }
    }

    public Path getFile() {
        return file;
    }
}
