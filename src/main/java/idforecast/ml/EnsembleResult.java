package idforecast.ml;

import java.util.List;

/** Consensus predictions, [test row][quantile index], plus per-fit importance reports. */
public final class EnsembleResult {

    private final double[][] predictions;
    private final List<FeatureImportance> featureImportance;

    public EnsembleResult(double[][] predictions, List<FeatureImportance> featureImportance) {
        this.predictions = predictions;
        this.featureImportance = List.copyOf(featureImportance);
    }

    public double[][] getPredictions() { return predictions; }

    /** Ordered by bag, then quantile level, then feature. */
    public List<FeatureImportance> getFeatureImportance() { return featureImportance; }
}
