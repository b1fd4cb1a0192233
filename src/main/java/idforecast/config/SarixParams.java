package idforecast.config;

/**
 * Orders of the seasonal autoregressive model: AR(p), seasonal AR(P) at lag s,
 * d regular and D seasonal differences.
 */
public final class SarixParams {

    public static final SarixParams DEFAULTS = new SarixParams(6, 0, 0, 0, 1, 1000);

    private final int p;
    private final int seasonalP;
    private final int d;
    private final int seasonalD;
    private final int seasonPeriod;
    private final int numSamples;

    public SarixParams(int p, int seasonalP, int d, int seasonalD, int seasonPeriod, int numSamples) {
        if (p < 0 || seasonalP < 0 || d < 0 || seasonalD < 0) {
            throw new IllegalArgumentException("SARIX orders must be non-negative");
        }
        if (seasonPeriod < 1) throw new IllegalArgumentException("season_period must be >= 1");
        if (numSamples < 1) throw new IllegalArgumentException("num_samples must be >= 1");
        this.p = p;
        this.seasonalP = seasonalP;
        this.d = d;
        this.seasonalD = seasonalD;
        this.seasonPeriod = seasonPeriod;
        this.numSamples = numSamples;
    }

    public int getP() { return p; }
    public int getSeasonalP() { return seasonalP; }
    public int getD() { return d; }
    public int getSeasonalD() { return seasonalD; }
    public int getSeasonPeriod() { return seasonPeriod; }
    public int getNumSamples() { return numSamples; }
}
