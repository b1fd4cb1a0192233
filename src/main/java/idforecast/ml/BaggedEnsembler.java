package idforecast.ml;

import idforecast.config.ModelConfig;
import idforecast.config.QuantileLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Season-blocked bagging of per-quantile models with median aggregation across bags.
 * <p>
 * Every (bag, quantile) fit is an independent task with a seed fixed before any task runs, so the
 * result does not depend on the number of worker threads or the completion order.
 */
public class BaggedEnsembler {

    private static final Logger log = LoggerFactory.getLogger(BaggedEnsembler.class);

    private final int numBags;
    private final double bagFracSamples;
    private final int numThreads;
    private final QuantileTrainer trainer;

    public BaggedEnsembler(ModelConfig config, QuantileTrainer trainer) {
        this(config.getNumBags(), config.getBagFracSamples(), config.getNumThreads(), trainer);
    }

    public BaggedEnsembler(int numBags, double bagFracSamples, int numThreads, QuantileTrainer trainer) {
        if (numBags < 1) throw new IllegalArgumentException("numBags must be >= 1");
        if (!(bagFracSamples > 0 && bagFracSamples <= 1)) throw new IllegalArgumentException("bagFracSamples must be in (0, 1]");
        if (numThreads < 1) throw new IllegalArgumentException("numThreads must be >= 1");
        this.numBags = numBags;
        this.bagFracSamples = bagFracSamples;
        this.numThreads = numThreads;
        this.trainer = trainer;
    }

    private static final class BagFit {
        final double[] predictions;
        final double[] importance;

        BagFit(double[] predictions, double[] importance) {
            this.predictions = predictions;
            this.importance = importance;
        }
    }

    /**
     * Fit all bags and return the median prediction per test row and quantile level.
     *
     * @param location label recorded on importance reports
     */
    public EnsembleResult fitAndPredict(TrainingSet train, double[][] xTest, List<QuantileLevel> quantiles,
                                        LocalDate refDate, String location) {
        if (train.size() == 0) {
            throw new IllegalStateException("training set is empty for location " + location);
        }
        for (double[] row : xTest) {
            if (row.length != train.numFeatures()) {
                throw new IllegalStateException("test rows have " + row.length + " features, training rows have " + train.numFeatures());
            }
        }

        int numQ = quantiles.size();
        SeedSequence seeds = SeedSequence.forReferenceDate(refDate);
        long[][] fitSeeds = seeds.nextSeedMatrix(numBags, numQ);
        List<Bag> bags = drawBags(train, seeds);

        log.info("Fitting {} bags x {} quantile levels for {} on {} training rows with {} thread(s)",
            numBags, numQ, location, train.size(), numThreads);

        double[][][] predsByBag = new double[xTest.length][numBags][numQ];
        List<FeatureImportance> importance = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(numThreads, workerThreads());
        try {
            List<Future<BagFit>> futures = new ArrayList<>(numBags * numQ);
            for (Bag bag : bags) {
                double[][] bagX = bag.features(train);
                double[] bagY = bag.targets(train);
                for (int q = 0; q < numQ; q++) {
                    double level = quantiles.get(q).getLevel();
                    long seed = fitSeeds[bag.getIndex()][q];
                    futures.add(pool.submit(() -> {
                        QuantileModel model = trainer.fit(bagX, bagY, level, seed);
                        return new BagFit(model.predict(xTest), model.featureImportance());
                    }));
                }
            }

            // barrier: every fit completes before any aggregation
            for (int b = 0; b < numBags; b++) {
                for (int q = 0; q < numQ; q++) {
                    BagFit fit = await(futures.get(b * numQ + q), b, quantiles.get(q));
                    for (int i = 0; i < xTest.length; i++) predsByBag[i][b][q] = fit.predictions[i];
                    for (int f = 0; f < fit.importance.length; f++) {
                        importance.add(new FeatureImportance(train.getFeatureNames().get(f), fit.importance[f],
                            b, quantiles.get(q).getLevel(), location));
                    }
                }
                log.debug("Bag {}/{} complete for {}", b + 1, numBags, location);
            }
        } finally {
            pool.shutdownNow();
        }

        return new EnsembleResult(medianAcrossBags(predsByBag), importance);
    }

    private List<Bag> drawBags(TrainingSet train, SeedSequence seeds) {
        List<String> seasons = train.distinctSeasons();
        int perBag = (int) (seasons.size() * bagFracSamples);
        if (perBag < 1) {
            throw new IllegalStateException("bag_frac_samples " + bagFracSamples + " selects no season out of " + seasons.size());
        }
        List<Bag> bags = new ArrayList<>(numBags);
        for (int b = 0; b < numBags; b++) {
            Bag bag = Bag.draw(b, train, seasons, perBag, seeds);
            log.debug("Bag {} uses seasons {} ({} rows)", b, bag.getSeasons(), bag.size());
            bags.add(bag);
        }
        return bags;
    }

    private static BagFit await(Future<BagFit> future, int bag, QuantileLevel quantile) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new ModelFitException("model fit failed for bag " + bag + ", quantile level " + quantile.getLabel(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelFitException("interrupted waiting for bag " + bag + ", quantile level " + quantile.getLabel(), e);
        }
    }

    /**
     * Median over the bag axis of predictions laid out [test row][bag][quantile].
     */
    public static double[][] medianAcrossBags(double[][][] predsByBag) {
        double[][] out = new double[predsByBag.length][];
        for (int i = 0; i < predsByBag.length; i++) {
            double[][] byBag = predsByBag[i];
            int numQ = byBag.length == 0 ? 0 : byBag[0].length;
            out[i] = new double[numQ];
            double[] column = new double[byBag.length];
            for (int q = 0; q < numQ; q++) {
                for (int b = 0; b < byBag.length; b++) column[b] = byBag[b][q];
                out[i][q] = Quantiles.median(column);
            }
        }
        return out;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "bag-fit-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
