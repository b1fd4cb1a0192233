package idforecast.data;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the engineered feature table. Every column that is not part of the fixed schema is a feature.
 * Empty cells, "NA" and "NaN" are missing values.
 */
public final class ObservationCsvReader {

    private static final Logger log = LoggerFactory.getLogger(ObservationCsvReader.class);

    public static final List<String> FIXED_COLUMNS = List.of(
        "source", "location", "wk_end_date", "season", "season_week", "pop",
        "inc_trans_cs", "inc_trans_center_factor", "inc_trans_scale_factor", "horizon", "delta_target");

    private ObservationCsvReader() {
    }

    public static ObservationTable read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ObservationTable table = read(reader);
            log.info("Loaded {} observation rows with {} feature columns from {}",
                table.size(), table.getFeatureColumns().size(), path);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read observations from " + path, e);
        }
    }

    public static ObservationTable read(Reader reader) throws IOException {
        try (CSVParser parser = new CSVParser(reader, CSVFormat.DEFAULT
                .withFirstRecordAsHeader()
                .withTrim())) {
            Map<String, Integer> header = parser.getHeaderMap();
            for (String col : FIXED_COLUMNS) {
                if (!header.containsKey(col)) {
                    throw new IllegalStateException("observation table is missing column '" + col + "'");
                }
            }
            List<String> featureColumns = new ArrayList<>();
            for (String col : parser.getHeaderNames()) {
                if (!FIXED_COLUMNS.contains(col)) featureColumns.add(col);
            }

            List<ObservationRow> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(parseRow(record, featureColumns));
            }
            return new ObservationTable(featureColumns, rows);
        }
    }

    private static ObservationRow parseRow(CSVRecord record, List<String> featureColumns) {
        double[] extras = new double[featureColumns.size()];
        for (int i = 0; i < extras.length; i++) {
            extras[i] = number(record, featureColumns.get(i));
        }
        return new ObservationRow(
            record.get("source"),
            record.get("location"),
            date(record, "wk_end_date"),
            record.get("season"),
            (int) required(record, "season_week"),
            required(record, "pop"),
            number(record, "inc_trans_cs"),
            required(record, "inc_trans_center_factor"),
            required(record, "inc_trans_scale_factor"),
            (int) required(record, "horizon"),
            number(record, "delta_target"),
            extras);
    }

    private static LocalDate date(CSVRecord record, String col) {
        String raw = record.get(col);
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("line " + record.getRecordNumber() + ": bad date in " + col + ": '" + raw + "'", e);
        }
    }

    private static double required(CSVRecord record, String col) {
        double v = number(record, col);
        if (Double.isNaN(v)) {
            throw new IllegalStateException("line " + record.getRecordNumber() + ": missing value in " + col);
        }
        return v;
    }

    private static double number(CSVRecord record, String col) {
        String raw = record.get(col);
        if (raw == null || raw.isEmpty() || raw.equals("NA") || raw.equals("NaN")) return Double.NaN;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("line " + record.getRecordNumber() + ": not a number in " + col + ": '" + raw + "'", e);
        }
    }
}
