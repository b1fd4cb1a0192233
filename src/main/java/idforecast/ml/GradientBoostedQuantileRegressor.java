package idforecast.ml;

import idforecast.config.BoosterParams;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Gradient-boosted regression trees minimizing the pinball (quantile) loss.
 * <p>
 * Loss at level α for residual r = y - ŷ: α·r if r &gt; 0, (α - 1)·r otherwise.
 * <p>
 * Boosting starts from the α-quantile of y. Each round fits a tree to the negative gradient
 * (α where the residual is positive, α - 1 elsewhere) and renews its leaves with the α-quantile of
 * the leaf residuals. The seed only matters when {@code subsample < 1}.
 */
public class GradientBoostedQuantileRegressor implements QuantileModel {

    private final double alpha;
    private final int numFeatures;
    private final double initScore;
    private final List<QuantileRegressionTree> trees;
    private final double[] featureImportance;

    /**
     * Fit the model.
     *
     * @param x      design matrix (rows = observations, columns = features; NaN = missing)
     * @param y      response vector (length = number of observations)
     * @param alpha  quantile level in (0, 1)
     * @param params booster settings
     * @param seed   seed for row subsampling
     */
    public GradientBoostedQuantileRegressor(double[][] x, double[] y, double alpha, BoosterParams params, long seed) {
        if (x == null || y == null || x.length != y.length || x.length == 0) {
            throw new IllegalArgumentException("X and y must be non-null, same length, and non-empty");
        }
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("alpha must be in (0, 1), got " + alpha);
        }
        int n = x.length;
        this.alpha = alpha;
        this.numFeatures = x[0].length;
        for (int i = 0; i < n; i++) {
            if (x[i].length != numFeatures) throw new IllegalArgumentException("ragged design matrix at row " + i);
            if (Double.isNaN(y[i])) throw new IllegalArgumentException("missing target value at row " + i);
        }

        RandomGenerator rng = new Well19937c(seed);
        int[][] sortedByFeature = sortByFeature(x);
        this.initScore = Quantiles.of(y, alpha);

        double[] score = new double[n];
        Arrays.fill(score, initScore);
        double[] gradient = new double[n];
        double[] residual = new double[n];
        int[] splitCounts = new int[numFeatures];
        this.trees = new ArrayList<>(params.getNumTrees());

        for (int t = 0; t < params.getNumTrees(); t++) {
            for (int i = 0; i < n; i++) {
                residual[i] = y[i] - score[i];
                gradient[i] = residual[i] > 0 ? alpha : alpha - 1.0;
            }
            boolean[] inBag = sampleRows(n, params.getSubsample(), rng);
            QuantileRegressionTree tree = QuantileRegressionTree.grow(x, sortedByFeature, gradient, residual, inBag, alpha, params);
            trees.add(tree);
            for (int i = 0; i < n; i++) score[i] += tree.predict(x[i]);
            tree.addSplitCounts(splitCounts);
        }

        this.featureImportance = new double[numFeatures];
        for (int f = 0; f < numFeatures; f++) featureImportance[f] = splitCounts[f];
    }

    private static int[][] sortByFeature(double[][] x) {
        int numFeatures = x[0].length;
        int[][] sorted = new int[numFeatures][];
        for (int f = 0; f < numFeatures; f++) {
            final int col = f;
            List<Integer> present = new ArrayList<>(x.length);
            for (int i = 0; i < x.length; i++) {
                if (!Double.isNaN(x[i][col])) present.add(i);
            }
            present.sort(Comparator.comparingDouble(i -> x[i][col]));
            sorted[f] = present.stream().mapToInt(Integer::intValue).toArray();
        }
        return sorted;
    }

    private static boolean[] sampleRows(int n, double subsample, RandomGenerator rng) {
        boolean[] inBag = new boolean[n];
        if (subsample >= 1.0) {
            Arrays.fill(inBag, true);
            return inBag;
        }
        int k = Math.max(1, (int) (n * subsample));
        for (int i : new RandomDataGenerator(rng).nextPermutation(n, k)) inBag[i] = true;
        return inBag;
    }

    public double getAlpha() { return alpha; }

    public int getNumTrees() { return trees.size(); }

    /** Predict one observation. */
    public double predict(double[] row) {
        if (row.length != numFeatures) {
            throw new IllegalStateException("expected " + numFeatures + " features, got " + row.length);
        }
        double y = initScore;
        for (QuantileRegressionTree tree : trees) y += tree.predict(row);
        return y;
    }

    @Override
    public double[] predict(double[][] x) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = predict(x[i]);
        }
        return out;
    }

    /** Number of splits made on each feature. */
    @Override
    public double[] featureImportance() {
        return featureImportance.clone();
    }
}
