package idforecast.hub;

import idforecast.config.PowerTransform;
import idforecast.config.QuantileLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps predicted deltas in transformed, centered and scaled space back to counts.
 */
public class ScaleInverter {

    /** Incidence is modeled per this many people. */
    public static final double RATE_UNIT = 100_000.0;

    private final PowerTransform transform;

    public ScaleInverter(PowerTransform transform) {
        if (transform == null) throw new IllegalArgumentException("power transform required");
        this.transform = transform;
    }

    /**
     * Count for one predicted delta, never negative.
     */
    public double invert(double incTransCs, double delta, double centerFactor, double scaleFactor, double pop) {
        double csTarget = incTransCs + delta;
        double transTarget = transform.uncenterAndUnscale(csTarget, centerFactor, scaleFactor);
        double rate = transform.inverse(transTarget);
        return Math.max(rate * pop / RATE_UNIT, 0.0);
    }

    /**
     * Invert every (row, quantile) pair. Output is ordered quantile by quantile, rows in input order
     * within each quantile.
     */
    public List<CountForecast> invert(List<WidePrediction> predictions, List<QuantileLevel> quantiles) {
        List<CountForecast> out = new ArrayList<>(predictions.size() * quantiles.size());
        for (int q = 0; q < quantiles.size(); q++) {
            for (WidePrediction p : predictions) {
                double value = invert(p.getIncTransCs(), p.delta(q), p.getCenterFactor(), p.getScaleFactor(), p.getPop());
                out.add(new CountForecast(p.getLocation(), p.getWkEndDate(), p.getHorizon(), quantiles.get(q), value));
            }
        }
        return out;
    }
}
