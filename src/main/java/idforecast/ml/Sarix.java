package idforecast.ml;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Seasonal autoregressive model fitted by conditional least squares.
 * <p>
 * Model on the differenced series z: z_t = c + φ₁z_{t-1} + ... + φₚz_{t-p} + Φ₁z_{t-s} + ... + Φ_P z_{t-Ps} + ε_t,
 * ε_t ~ N(0, σ²), where z = ∇^d ∇_s^D y.
 * <p>
 * Coefficients are shared by every series passed to the constructor, so fitting several locations
 * together pools them.
 */
public class Sarix {

    private final int p, d, P, D, s;
    /** c, φ₁..φₚ, Φ₁..Φ_P */
    private final double[] coefficients;
    private final double sigma;

    public Sarix(int p, int d, int P, int D, int s, List<double[]> series) {
        if (series.isEmpty()) throw new IllegalArgumentException("at least one series required");
        this.p = p;
        this.d = d;
        this.P = P;
        this.D = D;
        this.s = s;

        List<double[]> design = new ArrayList<>();
        List<Double> response = new ArrayList<>();
        int start = p + s * P;
        for (double[] y : series) {
            double[] z = difference(y);
            for (int t = start; t < z.length; t++) {
                design.add(lagRow(z, t));
                response.add(z[t]);
            }
        }
        int numParams = p + P + 1;
        if (response.size() <= numParams) {
            throw new IllegalStateException("SARIX needs more than " + numParams + " usable observations, got " + response.size());
        }
        double[] yv = response.stream().mapToDouble(Double::doubleValue).toArray();

        if (p + P == 0) {
            this.coefficients = new double[] {new Mean().evaluate(yv)};
            this.sigma = new StandardDeviation().evaluate(yv);
        } else {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
            try {
                ols.newSampleData(yv, design.toArray(new double[0][]));
                this.coefficients = ols.estimateRegressionParameters();
                this.sigma = Math.sqrt(ols.estimateErrorVariance());
            } catch (MathIllegalArgumentException e) {
                throw new IllegalStateException("SARIX design matrix is degenerate: " + e.getMessage(), e);
            }
        }
    }

    /** Lag order of each differencing step, regular first, then seasonal. */
    private int[] differencingLags() {
        int[] lags = new int[d + D];
        for (int i = 0; i < d; i++) lags[i] = 1;
        for (int i = 0; i < D; i++) lags[d + i] = s;
        return lags;
    }

    private double[] difference(double[] series) {
        double[] z = series.clone();
        for (int lag : differencingLags()) {
            z = diff(z, lag);
        }
        return z;
    }

    private static double[] diff(double[] x, int lag) {
        if (lag >= x.length) return new double[0];
        double[] out = new double[x.length - lag];
        for (int i = lag; i < x.length; i++) {
            out[i - lag] = x[i] - x[i - lag];
        }
        return out;
    }

    private double[] lagRow(double[] z, int t) {
        double[] row = new double[p + P];
        for (int i = 0; i < p; i++) row[i] = z[t - 1 - i];
        for (int i = 0; i < P; i++) row[p + i] = z[t - s * (i + 1)];
        return row;
    }

    private double mean(double[] z, int t) {
        double pred = coefficients[0];
        for (int i = 0; i < p; i++) pred += coefficients[1 + i] * z[t - 1 - i];
        for (int i = 0; i < P; i++) pred += coefficients[1 + p + i] * z[t - s * (i + 1)];
        return pred;
    }

    /**
     * Simulate future paths on the original scale.
     *
     * @return [sample][step] levels for steps 1..{@code steps} after the end of {@code series}
     */
    public double[][] samplePaths(double[] series, int steps, int numSamples, SeedSequence seeds) {
        int[] lags = differencingLags();
        List<double[]> stages = new ArrayList<>(lags.length + 1);
        stages.add(series.clone());
        for (int lag : lags) stages.add(diff(stages.get(stages.size() - 1), lag));
        double[] z = stages.get(stages.size() - 1);
        if (z.length < Math.max(1, p + s * P)) {
            throw new IllegalStateException("series too short to forecast: " + series.length + " observations");
        }

        double[][] paths = new double[numSamples][];
        for (int k = 0; k < numSamples; k++) {
            double[] ext = Arrays.copyOf(z, z.length + steps);
            for (int t = z.length; t < ext.length; t++) {
                ext[t] = mean(ext, t) + sigma * seeds.nextGaussian();
            }
            paths[k] = integrate(stages, lags, Arrays.copyOfRange(ext, z.length, ext.length));
        }
        return paths;
    }

    /** Undo the differencing steps, last one first. */
    private static double[] integrate(List<double[]> stages, int[] lags, double[] future) {
        double[] out = future;
        for (int k = lags.length - 1; k >= 0; k--) {
            double[] base = stages.get(k);
            double[] ext = Arrays.copyOf(base, base.length + out.length);
            for (int i = 0; i < out.length; i++) {
                int t = base.length + i;
                ext[t] = out[i] + ext[t - lags[k]];
            }
            out = Arrays.copyOfRange(ext, base.length, ext.length);
        }
        return out;
    }

    public double getSigma() { return sigma; }

    /** [c, φ₁..φₚ, Φ₁..Φ_P] */
    public double[] getCoefficients() { return coefficients.clone(); }
}
