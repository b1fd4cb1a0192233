package idforecast;

import idforecast.config.ConfigLoader;
import idforecast.config.ModelConfig;
import idforecast.config.RunConfig;
import idforecast.data.ObservationCsvReader;
import idforecast.data.ObservationTable;
import idforecast.model.ForecastModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runs one forecast from configuration files and an engineered feature table.
 * <p>
 * Usage: {@code Main <model-config.json> <run-config.json> <features.csv>}
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length < 3) {
            System.err.println("usage: Main <model-config.json> <run-config.json> <features.csv>");
            System.exit(2);
        }
        try {
            ModelConfig modelConfig = ConfigLoader.loadModelConfig(Paths.get(args[0].trim()));
            RunConfig runConfig = ConfigLoader.loadRunConfig(Paths.get(args[1].trim()));
            ObservationTable table = ObservationCsvReader.read(Paths.get(args[2].trim()));
            log.info("Running {} model '{}' for {} {}", modelConfig.getModelClass().getConfigName(),
                modelConfig.getModelName(), runConfig.getDisease().getConfigName(), runConfig.getRefDate());
            Path saved = ForecastModels.create(modelConfig).run(runConfig, table);
            log.info("Forecast saved to {}", saved);
        } catch (RuntimeException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Forecast run failed: {}", msg, e);
            System.exit(1);
        }
    }
}
