package idforecast.hub;

import idforecast.config.ModelConfig;
import idforecast.config.RunConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Output locations: {@code <root>/UMass-<model>[/<subdir>]/<ref_date>-UMass-<model>.csv}.
 */
public final class SavePaths {

    public static final String PROVIDER = "UMass";
    public static final String FEAT_IMPORTANCE_SUBDIR = "feat_importance";

    private SavePaths() {
    }

    public static String modelDirName(ModelConfig modelConfig) {
        return PROVIDER + "-" + modelConfig.getModelName();
    }

    public static String fileName(RunConfig runConfig, ModelConfig modelConfig) {
        return runConfig.getRefDate() + "-" + modelDirName(modelConfig) + ".csv";
    }

    /** Resolve the file path and create its parent directories. */
    public static Path buildSavePath(Path root, RunConfig runConfig, ModelConfig modelConfig, String subdir) {
        Path dir = root.resolve(modelDirName(modelConfig));
        if (subdir != null) dir = dir.resolve(subdir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create output directory " + dir, e);
        }
        return dir.resolve(fileName(runConfig, modelConfig));
    }
}
