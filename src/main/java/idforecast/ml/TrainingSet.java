package idforecast.ml;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Training matrix, targets and the season each row belongs to. */
public final class TrainingSet {

    private final double[][] x;
    private final double[] y;
    private final String[] seasons;
    private final List<String> featureNames;

    public TrainingSet(double[][] x, double[] y, String[] seasons, List<String> featureNames) {
        if (x.length != y.length || x.length != seasons.length) {
            throw new IllegalStateException("training rows, targets and seasons differ in length: "
                + x.length + ", " + y.length + ", " + seasons.length);
        }
        for (double[] row : x) {
            if (row.length != featureNames.size()) {
                throw new IllegalStateException("training row has " + row.length + " features, expected " + featureNames.size());
            }
        }
        this.x = x;
        this.y = y;
        this.seasons = seasons;
        this.featureNames = List.copyOf(featureNames);
    }

    public int size() { return y.length; }
    public int numFeatures() { return featureNames.size(); }
    public List<String> getFeatureNames() { return featureNames; }
    double[][] getX() { return x; }
    double[] getY() { return y; }

    String seasonOf(int row) {
        return seasons[row];
    }

    /** Distinct seasons in order of first appearance. */
    public List<String> distinctSeasons() {
        Set<String> seen = new LinkedHashSet<>();
        for (String s : seasons) seen.add(s);
        return new ArrayList<>(seen);
    }
}
