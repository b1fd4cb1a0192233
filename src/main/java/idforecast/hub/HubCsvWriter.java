package idforecast.hub;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes hub rows as CSV with the published column order. */
public final class HubCsvWriter {

    private HubCsvWriter() {
    }

    public static void write(Path path, List<HubRow> rows) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write forecasts to " + path, e);
        }
    }

    public static void write(Writer writer, List<HubRow> rows) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT
            .withHeader(HubRow.COLUMNS.toArray(new String[0]))
            .withRecordSeparator('\n'));
        for (HubRow r : rows) {
            printer.printRecord(r.getLocation(), r.getReferenceDate(), r.getHorizon(), r.getTargetEndDate(),
                r.getTarget(), r.getOutputType(), r.getOutputTypeId(), r.getValue());
        }
        printer.flush();
    }
}
