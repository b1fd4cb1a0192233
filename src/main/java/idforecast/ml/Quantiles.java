package idforecast.ml;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/** Empirical quantiles with linear interpolation between order statistics. */
final class Quantiles {

    private Quantiles() {
    }

    /** Quantile at probability {@code alpha} in (0, 1). */
    static double of(double[] values, double alpha) {
        if (values.length == 0) throw new IllegalArgumentException("no values");
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, alpha * 100.0);
    }

    static double median(double[] values) {
        return new Median().evaluate(values);
    }
}
