package idforecast.config;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Reads model and run configuration from JSON (snake_case keys) into validated config objects.
 */
public final class ConfigLoader {

    private static final Gson GSON = new Gson();
    private static final Type STRING_LIST = new TypeToken<List<String>>() {}.getType();
    private static final Type DOUBLE_LIST = new TypeToken<List<Double>>() {}.getType();

    private ConfigLoader() {
    }

    public static ModelConfig loadModelConfig(Path path) {
        return modelConfig(readObject(path));
    }

    public static RunConfig loadRunConfig(Path path) {
        return runConfig(readObject(path));
    }

    public static ModelConfig modelConfig(JsonObject json) {
        ModelConfig.Builder b = ModelConfig.builder(string(json, "model_name", null));
        b.modelClass(ModelClass.fromConfig(string(json, "model_class", "gbqr")));
        if (json.has("num_bags")) b.numBags(json.get("num_bags").getAsInt());
        if (json.has("bag_frac_samples")) b.bagFracSamples(json.get("bag_frac_samples").getAsDouble());
        if (json.has("fit_locations_separately")) b.fitLocationsSeparately(json.get("fit_locations_separately").getAsBoolean());
        if (json.has("power_transform")) b.powerTransform(PowerTransform.fromConfig(string(json, "power_transform", null)));
        if (json.has("incl_level_feats")) b.inclLevelFeats(json.get("incl_level_feats").getAsBoolean());
        if (json.has("sources")) b.sources(GSON.fromJson(json.get("sources"), STRING_LIST));
        if (json.has("target_source")) b.targetSource(string(json, "target_source", null));
        if (json.has("num_threads")) b.numThreads(json.get("num_threads").getAsInt());
        if (json.has("booster")) b.booster(booster(json.getAsJsonObject("booster")));
        if (json.has("sarix")) b.sarix(sarix(json.getAsJsonObject("sarix")));
        return b.build();
    }

    public static RunConfig runConfig(JsonObject json) {
        RunConfig.Builder b = RunConfig.builder()
            .disease(Disease.fromConfig(string(json, "disease", null)))
            .quantiles(GSON.fromJson(json.get("q_levels"), DOUBLE_LIST), GSON.fromJson(json.get("q_labels"), STRING_LIST))
            .saveFeatImportance(json.has("save_feat_importance") && json.get("save_feat_importance").getAsBoolean());
        String refDate = string(json, "ref_date", null);
        if (refDate != null) {
            try {
                b.refDate(LocalDate.parse(refDate));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("ref_date must be an ISO date, got '" + refDate + "'", e);
            }
        }
        if (json.has("max_horizon")) b.maxHorizon(json.get("max_horizon").getAsInt());
        if (json.has("locations") && !json.get("locations").isJsonNull()) {
            b.locations(GSON.fromJson(json.get("locations"), STRING_LIST));
        }
        String outputRoot = string(json, "output_root", null);
        if (outputRoot != null) b.outputRoot(Path.of(outputRoot));
        String artifactRoot = string(json, "artifact_store_root", null);
        if (artifactRoot != null) b.artifactStoreRoot(Path.of(artifactRoot));
        return b.build();
    }

    private static BoosterParams booster(JsonObject json) {
        BoosterParams d = BoosterParams.DEFAULTS;
        return new BoosterParams(
            intOr(json, "num_trees", d.getNumTrees()),
            doubleOr(json, "learning_rate", d.getLearningRate()),
            intOr(json, "num_leaves", d.getNumLeaves()),
            intOr(json, "min_child_samples", d.getMinChildSamples()),
            doubleOr(json, "subsample", d.getSubsample()));
    }

    private static SarixParams sarix(JsonObject json) {
        SarixParams d = SarixParams.DEFAULTS;
        return new SarixParams(
            intOr(json, "p", d.getP()),
            intOr(json, "P", d.getSeasonalP()),
            intOr(json, "d", d.getD()),
            intOr(json, "D", d.getSeasonalD()),
            intOr(json, "season_period", d.getSeasonPeriod()),
            intOr(json, "num_samples", d.getNumSamples()));
    }

    private static JsonObject readObject(Path path) {
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            return parseObject(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read config " + path, e);
        }
    }

    /** Parse a JSON object, reporting malformed input as a configuration error. */
    public static JsonObject parseObject(String text) {
        JsonElement el;
        try {
            el = GSON.fromJson(text, JsonElement.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getMessage(), e);
        }
        if (el == null || !el.isJsonObject()) {
            throw new IllegalArgumentException("Config must be a JSON object");
        }
        return el.getAsJsonObject();
    }

    private static String string(JsonObject json, String key, String def) {
        JsonElement el = json.get(key);
        if (el == null || el.isJsonNull()) return def;
        return el.getAsString();
    }

    private static int intOr(JsonObject json, String key, int def) {
        return json.has(key) ? json.get(key).getAsInt() : def;
    }

    private static double doubleOr(JsonObject json, String key, double def) {
        return json.has(key) ? json.get(key).getAsDouble() : def;
    }
}
