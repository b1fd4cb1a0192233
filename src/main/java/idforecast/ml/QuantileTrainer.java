package idforecast.ml;

/**
 * Fits one pinball-loss model. Identical inputs and seed must give identical predictions.
 */
@FunctionalInterface
public interface QuantileTrainer {

    QuantileModel fit(double[][] x, double[] y, double alpha, long seed);
}
