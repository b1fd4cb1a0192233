package idforecast.config;

/**
 * Gradient boosting settings for one quantile model. Defaults follow LightGBM's.
 */
public final class BoosterParams {

    public static final BoosterParams DEFAULTS = new BoosterParams(100, 0.1, 31, 20, 1.0);

    private final int numTrees;
    private final double learningRate;
    private final int numLeaves;
    private final int minChildSamples;
    /** Fraction of training rows drawn (without replacement) for each tree. */
    private final double subsample;

    public BoosterParams(int numTrees, double learningRate, int numLeaves, int minChildSamples, double subsample) {
        if (numTrees < 1) throw new IllegalArgumentException("num_trees must be >= 1");
        if (!(learningRate > 0)) throw new IllegalArgumentException("learning_rate must be > 0");
        if (numLeaves < 2) throw new IllegalArgumentException("num_leaves must be >= 2");
        if (minChildSamples < 1) throw new IllegalArgumentException("min_child_samples must be >= 1");
        if (!(subsample > 0 && subsample <= 1)) throw new IllegalArgumentException("subsample must be in (0, 1]");
        this.numTrees = numTrees;
        this.learningRate = learningRate;
        this.numLeaves = numLeaves;
        this.minChildSamples = minChildSamples;
        this.subsample = subsample;
    }

    public int getNumTrees() { return numTrees; }
    public double getLearningRate() { return learningRate; }
    public int getNumLeaves() { return numLeaves; }
    public int getMinChildSamples() { return minChildSamples; }
    public double getSubsample() { return subsample; }
}
