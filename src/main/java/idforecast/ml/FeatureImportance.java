package idforecast.ml;

/** Importance of one feature in the model fitted for one (bag, quantile level). */
public final class FeatureImportance {

    /** Location label for models fitted to all locations jointly. */
    public static final String ALL_LOCATIONS = "all";

    private final String feature;
    private final double importance;
    private final int bagIndex;
    private final double quantileLevel;
    private final String location;

    public FeatureImportance(String feature, double importance, int bagIndex, double quantileLevel, String location) {
        this.feature = feature;
        this.importance = importance;
        this.bagIndex = bagIndex;
        this.quantileLevel = quantileLevel;
        this.location = location;
    }

    public String getFeature() { return feature; }
    public double getImportance() { return importance; }
    public int getBagIndex() { return bagIndex; }
    public double getQuantileLevel() { return quantileLevel; }
    public String getLocation() { return location; }
}
