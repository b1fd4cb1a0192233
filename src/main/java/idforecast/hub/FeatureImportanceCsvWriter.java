package idforecast.hub;

import idforecast.ml.FeatureImportance;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes per-fit feature importance as CSV, one row per feature. */
public final class FeatureImportanceCsvWriter {

    public static final String[] COLUMNS = {"feat", "importance", "bag_index", "quantile_level", "location"};

    private FeatureImportanceCsvWriter() {
    }

    public static void write(Path path, List<FeatureImportance> rows) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.withHeader(COLUMNS).withRecordSeparator('\n'))) {
            for (FeatureImportance f : rows) {
                printer.printRecord(f.getFeature(), f.getImportance(), f.getBagIndex(), f.getQuantileLevel(), f.getLocation());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write feature importance to " + path, e);
        }
    }
}
