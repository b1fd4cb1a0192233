package idforecast.ml;

import idforecast.config.BoosterParams;

import java.util.ArrayList;
import java.util.List;

/**
 * One boosting round's tree, grown leaf-wise.
 * <p>
 * Splits are chosen by least-squares gain on the pinball gradient; leaf outputs are then replaced by the
 * alpha-quantile of the residuals that fall in the leaf, shrunk by the learning rate.
 * Rows go left when {@code x <= threshold}; missing values follow the side learned for them.
 */
final class QuantileRegressionTree {

    private static final double MIN_GAIN = 1e-12;

    private final Node root;
    private final int[] splitCounts;

    private QuantileRegressionTree(Node root, int[] splitCounts) {
        this.root = root;
        this.splitCounts = splitCounts;
    }

    private static final class Node {
        final int id;
        int feature = -1;
        double threshold;
        boolean missingLeft;
        Node left;
        Node right;
        double value;

        int count;
        double gradSum;
        Split best;

        Node(int id) {
            this.id = id;
        }
    }

    private static final class Split {
        final int feature;
        final double threshold;
        final boolean missingLeft;
        final double gain;

        Split(int feature, double threshold, boolean missingLeft, double gain) {
            this.feature = feature;
            this.threshold = threshold;
            this.missingLeft = missingLeft;
            this.gain = gain;
        }
    }

    /**
     * @param x               training features, row-major
     * @param sortedByFeature per feature, indices of rows with a non-missing value in ascending value order
     * @param gradient        negative pinball gradient per row
     * @param residual        y minus current score per row
     * @param inBag           rows used for this tree
     */
    static QuantileRegressionTree grow(double[][] x, int[][] sortedByFeature, double[] gradient, double[] residual,
                                       boolean[] inBag, double alpha, BoosterParams params) {
        int n = x.length;
        int numFeatures = sortedByFeature.length;
        int minChild = params.getMinChildSamples();
        int[] leafOf = new int[n];
        int[] buf = new int[n];
        int[] splitCounts = new int[numFeatures];

        Node root = new Node(0);
        for (int i = 0; i < n; i++) {
            if (inBag[i]) {
                leafOf[i] = root.id;
                root.count++;
                root.gradSum += gradient[i];
            } else {
                leafOf[i] = -1;
            }
        }
        root.best = findSplit(root, x, sortedByFeature, gradient, leafOf, minChild, buf);

        List<Node> leaves = new ArrayList<>();
        leaves.add(root);
        int nextId = 1;
        while (leaves.size() < params.getNumLeaves()) {
            Node target = null;
            for (Node leaf : leaves) {
                if (leaf.best != null && (target == null || leaf.best.gain > target.best.gain)) target = leaf;
            }
            if (target == null) break;

            Split s = target.best;
            Node left = new Node(nextId++);
            Node right = new Node(nextId++);
            for (int i = 0; i < n; i++) {
                if (leafOf[i] != target.id) continue;
                Node child = goesLeft(x[i][s.feature], s.threshold, s.missingLeft) ? left : right;
                leafOf[i] = child.id;
                child.count++;
                child.gradSum += gradient[i];
            }
            target.feature = s.feature;
            target.threshold = s.threshold;
            target.missingLeft = s.missingLeft;
            target.left = left;
            target.right = right;
            target.best = null;
            splitCounts[s.feature]++;

            leaves.remove(target);
            leaves.add(left);
            leaves.add(right);
            left.best = findSplit(left, x, sortedByFeature, gradient, leafOf, minChild, buf);
            right.best = findSplit(right, x, sortedByFeature, gradient, leafOf, minChild, buf);
        }

        for (Node leaf : leaves) {
            double[] leafResiduals = new double[leaf.count];
            int k = 0;
            for (int i = 0; i < n; i++) {
                if (leafOf[i] == leaf.id) leafResiduals[k++] = residual[i];
            }
            leaf.value = Quantiles.of(leafResiduals, alpha) * params.getLearningRate();
        }
        return new QuantileRegressionTree(root, splitCounts);
    }

    private static Split findSplit(Node leaf, double[][] x, int[][] sortedByFeature, double[] gradient,
                                   int[] leafOf, int minChild, int[] buf) {
        if (leaf.count < 2 * minChild) return null;
        double parentScore = leaf.gradSum * leaf.gradSum / leaf.count;
        Split best = null;

        for (int f = 0; f < sortedByFeature.length; f++) {
            int k = 0;
            double presentGrad = 0;
            for (int idx : sortedByFeature[f]) {
                if (leafOf[idx] == leaf.id) {
                    buf[k++] = idx;
                    presentGrad += gradient[idx];
                }
            }
            if (k < 2) continue;
            int missingCount = leaf.count - k;
            double missingGrad = leaf.gradSum - presentGrad;

            double gl = 0;
            for (int i = 0; i < k - 1; i++) {
                gl += gradient[buf[i]];
                double v = x[buf[i]][f];
                if (v == x[buf[i + 1]][f]) continue;
                best = consider(best, leaf, f, v, false, gl, i + 1, minChild, parentScore);
                if (missingCount > 0) {
                    best = consider(best, leaf, f, v, true, gl + missingGrad, i + 1 + missingCount, minChild, parentScore);
                }
            }
        }
        return best;
    }

    private static Split consider(Split best, Node leaf, int feature, double threshold, boolean missingLeft,
                                  double leftGrad, int leftCount, int minChild, double parentScore) {
        int rightCount = leaf.count - leftCount;
        if (leftCount < minChild || rightCount < minChild) return best;
        double rightGrad = leaf.gradSum - leftGrad;
        double gain = leftGrad * leftGrad / leftCount + rightGrad * rightGrad / rightCount - parentScore;
        if (gain > MIN_GAIN && (best == null || gain > best.gain)) {
            return new Split(feature, threshold, missingLeft, gain);
        }
        return best;
    }

    private static boolean goesLeft(double value, double threshold, boolean missingLeft) {
        if (Double.isNaN(value)) return missingLeft;
        return value <= threshold;
    }

    double predict(double[] row) {
        Node node = root;
        while (node.feature >= 0) {
            node = goesLeft(row[node.feature], node.threshold, node.missingLeft) ? node.left : node.right;
        }
        return node.value;
    }

    void addSplitCounts(int[] totals) {
        for (int f = 0; f < splitCounts.length; f++) totals[f] += splitCounts[f];
    }
}
