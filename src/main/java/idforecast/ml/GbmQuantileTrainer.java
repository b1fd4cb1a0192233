package idforecast.ml;

import idforecast.config.BoosterParams;

/** Trains {@link GradientBoostedQuantileRegressor}s with fixed booster settings. */
public class GbmQuantileTrainer implements QuantileTrainer {

    private final BoosterParams params;

    public GbmQuantileTrainer(BoosterParams params) {
        this.params = params;
    }

    @Override
    public QuantileModel fit(double[][] x, double[] y, double alpha, long seed) {
        return new GradientBoostedQuantileRegressor(x, y, alpha, params, seed);
    }
}
