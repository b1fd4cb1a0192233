package idforecast.ml;

import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Single seeded source of all randomness in a run. Draws must be made in a fixed order
 * (fit seeds first, then bag samples) for results to reproduce.
 */
public final class SeedSequence {

    /** Exclusive upper bound of per-fit seeds. */
    public static final int FIT_SEED_BOUND = 100_000_000;

    private final RandomGenerator rng;
    private final RandomDataGenerator sampler;

    public SeedSequence(long masterSeed) {
        this.rng = new Well19937c(masterSeed);
        this.sampler = new RandomDataGenerator(rng);
    }

    public static SeedSequence forReferenceDate(LocalDate refDate) {
        return new SeedSequence(masterSeed(refDate));
    }

    /** Epoch seconds of the reference date at UTC midnight. */
    public static long masterSeed(LocalDate refDate) {
        return refDate.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }

    /** Seeds in [0, {@link #FIT_SEED_BOUND}), filled row by row. */
    public long[][] nextSeedMatrix(int rows, int cols) {
        long[][] seeds = new long[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                seeds[r][c] = rng.nextInt(FIT_SEED_BOUND);
            }
        }
        return seeds;
    }

    /** {@code k} distinct indices out of {@code 0..n-1}. */
    public int[] nextSample(int n, int k) {
        return sampler.nextPermutation(n, k);
    }

    public double nextGaussian() {
        return rng.nextGaussian();
    }
}
