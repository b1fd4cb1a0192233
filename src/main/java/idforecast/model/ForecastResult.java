package idforecast.model;

import idforecast.hub.HubRow;
import idforecast.ml.FeatureImportance;

import java.util.ArrayList;
import java.util.List;

/** Hub rows of a run and, for models that report it, feature importance. */
public final class ForecastResult {

    private final List<HubRow> hubRows;
    private final List<FeatureImportance> featureImportance;

    public ForecastResult(List<HubRow> hubRows, List<FeatureImportance> featureImportance) {
        this.hubRows = List.copyOf(hubRows);
        this.featureImportance = List.copyOf(featureImportance);
    }

    public static ForecastResult concat(List<ForecastResult> parts) {
        List<HubRow> rows = new ArrayList<>();
        List<FeatureImportance> importance = new ArrayList<>();
        for (ForecastResult part : parts) {
            rows.addAll(part.hubRows);
            importance.addAll(part.featureImportance);
        }
        return new ForecastResult(rows, importance);
    }

    public List<HubRow> getHubRows() { return hubRows; }
    public List<FeatureImportance> getFeatureImportance() { return featureImportance; }
}
