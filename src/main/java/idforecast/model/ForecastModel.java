package idforecast.model;

import idforecast.config.ModelConfig;
import idforecast.config.RunConfig;
import idforecast.data.ObservationTable;
import idforecast.hub.FeatureImportanceCsvWriter;
import idforecast.hub.HubCsvWriter;
import idforecast.hub.SavePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * A model family that turns engineered observations into hub quantile forecasts.
 * All families share the output contract and the persisted layout.
 */
public abstract class ForecastModel {

    private static final Logger log = LoggerFactory.getLogger(ForecastModel.class);

    protected final ModelConfig config;

    protected ForecastModel(ModelConfig config) {
        if (config == null) throw new IllegalArgumentException("model config required");
        this.config = config;
    }

    public ModelConfig getModelConfig() {
        return config;
    }

    /** Compute forecasts without touching the filesystem. */
    public abstract ForecastResult forecast(RunConfig runConfig, ObservationTable table);

    /**
     * Compute forecasts and write them (and feature importance, when requested) under the run's roots.
     *
     * @return path of the hub forecast file
     */
    public Path run(RunConfig runConfig, ObservationTable table) {
        long start = System.nanoTime();
        ForecastResult result = forecast(runConfig, table);

        Path savePath = SavePaths.buildSavePath(runConfig.getOutputRoot(), runConfig, config, null);
        HubCsvWriter.write(savePath, result.getHubRows());
        log.info("Wrote {} forecast rows for {} to {} in {} ms", result.getHubRows().size(), runConfig.getRefDate(),
            savePath, (System.nanoTime() - start) / 1_000_000);

        if (runConfig.isSaveFeatImportance() && !result.getFeatureImportance().isEmpty()) {
            Path importancePath = SavePaths.buildSavePath(runConfig.getArtifactStoreRoot(), runConfig, config,
                SavePaths.FEAT_IMPORTANCE_SUBDIR);
            FeatureImportanceCsvWriter.write(importancePath, result.getFeatureImportance());
            log.info("Wrote feature importance to {}", importancePath);
        }
        return savePath;
    }
}
