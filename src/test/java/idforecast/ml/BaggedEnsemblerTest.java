package idforecast.ml;

import idforecast.config.QuantileLevel;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BaggedEnsemblerTest {

    private static final LocalDate REF_DATE = LocalDate.of(2024, 1, 6);
    private static final List<QuantileLevel> QUANTILES = List.of(
        new QuantileLevel(0.025, "0.025"), new QuantileLevel(0.5, "0.5"), new QuantileLevel(0.975, "0.975"));

    /** Predicts its seed for every row; importance is the number of training rows. */
    private static final QuantileTrainer SEED_ECHO = (x, y, alpha, seed) -> new QuantileModel() {
        @Override
        public double[] predict(double[][] test) {
            double[] out = new double[test.length];
            Arrays.fill(out, seed);
            return out;
        }

        @Override
        public double[] featureImportance() {
            return new double[] {x.length, 0};
        }
    };

    /** Ten seasons of ten rows; column 0 holds the season index. */
    private static TrainingSet trainingSet() {
        int n = 100;
        double[][] x = new double[n][2];
        double[] y = new double[n];
        String[] seasons = new String[n];
        for (int i = 0; i < n; i++) {
            x[i][0] = i / 10;
            x[i][1] = i;
            y[i] = i % 10;
            seasons[i] = "season-" + (i / 10);
        }
        return new TrainingSet(x, y, seasons, List.of("season_idx", "row"));
    }

    private static final double[][] X_TEST = {{0, 0}, {1, 1}};

    @Test
    void medianOfBagPredictions() {
        double[][][] predsByBag = {{{1}, {2}, {3}, {4}, {5}}};

        assertThat(BaggedEnsembler.medianAcrossBags(predsByBag)[0][0]).isEqualTo(3.0);
    }

    @Test
    void medianIsTakenPerQuantileLevel() {
        double[][][] predsByBag = {{{5, 10}, {1, 30}, {3, 20}, {4, 0}}};

        assertThat(BaggedEnsembler.medianAcrossBags(predsByBag)[0]).containsExactly(3.5, 15.0);
    }

    @Test
    void resultDoesNotDependOnThreadCount() {
        EnsembleResult sequential = new BaggedEnsembler(8, 0.7, 1, SEED_ECHO)
            .fitAndPredict(trainingSet(), X_TEST, QUANTILES, REF_DATE, "all");
        EnsembleResult parallel = new BaggedEnsembler(8, 0.7, 4, SEED_ECHO)
            .fitAndPredict(trainingSet(), X_TEST, QUANTILES, REF_DATE, "all");

        assertThat(parallel.getPredictions()).isDeepEqualTo(sequential.getPredictions());
        assertThat(describe(parallel.getFeatureImportance())).isEqualTo(describe(sequential.getFeatureImportance()));
    }

    private static List<String> describe(List<FeatureImportance> importance) {
        return importance.stream()
            .map(f -> f.getBagIndex() + "/" + f.getQuantileLevel() + "/" + f.getFeature() + "=" + f.getImportance())
            .collect(Collectors.toList());
    }

    @Test
    void eachFitGetsItsPreDerivedSeed() {
        long[][] seeds = SeedSequence.forReferenceDate(REF_DATE).nextSeedMatrix(1, 3);

        EnsembleResult result = new BaggedEnsembler(1, 0.7, 2, SEED_ECHO)
            .fitAndPredict(trainingSet(), X_TEST, QUANTILES, REF_DATE, "all");

        assertThat(result.getPredictions()[0]).containsExactly(seeds[0][0], seeds[0][1], seeds[0][2]);
    }

    @Test
    void bagsHoldWholeSeasons() {
        Queue<double[][]> seen = new ConcurrentLinkedQueue<>();
        QuantileTrainer recording = (x, y, alpha, seed) -> {
            seen.add(x);
            return SEED_ECHO.fit(x, y, alpha, seed);
        };

        new BaggedEnsembler(5, 0.7, 1, recording).fitAndPredict(trainingSet(), X_TEST, QUANTILES, REF_DATE, "all");

        assertThat(seen).hasSize(5 * QUANTILES.size());
        for (double[][] bagX : seen) {
            Set<Double> seasons = new HashSet<>();
            for (double[] row : bagX) seasons.add(row[0]);
            assertThat(seasons).hasSize(7);
            assertThat(bagX).hasNumberOfRows(70);
        }
    }

    @Test
    void importanceIsOrderedByBagThenQuantile() {
        EnsembleResult result = new BaggedEnsembler(3, 0.5, 3, SEED_ECHO)
            .fitAndPredict(trainingSet(), X_TEST, QUANTILES, REF_DATE, "US");

        List<FeatureImportance> imp = result.getFeatureImportance();
        assertThat(imp).hasSize(3 * 3 * 2);
        assertThat(imp.get(0).getBagIndex()).isZero();
        assertThat(imp.get(0).getQuantileLevel()).isEqualTo(0.025);
        assertThat(imp.get(0).getFeature()).isEqualTo("season_idx");
        assertThat(imp.get(0).getImportance()).isEqualTo(50.0);
        assertThat(imp.get(2).getQuantileLevel()).isEqualTo(0.5);
        assertThat(imp.get(6).getBagIndex()).isEqualTo(1);
        assertThat(imp).allMatch(f -> f.getLocation().equals("US"));
    }

    @Test
    void fitFailureAbortsTheRun() {
        QuantileTrainer failing = (x, y, alpha, seed) -> {
            if (alpha == 0.5) throw new IllegalStateException("numerical failure");
            return SEED_ECHO.fit(x, y, alpha, seed);
        };

        assertThatThrownBy(() -> new BaggedEnsembler(2, 0.7, 2, failing)
            .fitAndPredict(trainingSet(), X_TEST, QUANTILES, REF_DATE, "all"))
            .isInstanceOf(ModelFitException.class)
            .hasMessageContaining("bag 0")
            .hasRootCauseMessage("numerical failure");
    }

    @Test
    void rejectsTestSchemaMismatch() {
        assertThatThrownBy(() -> new BaggedEnsembler(2, 0.7, 1, SEED_ECHO)
            .fitAndPredict(trainingSet(), new double[][] {{1, 2, 3}}, QUANTILES, REF_DATE, "all"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsEmptyTrainingSet() {
        TrainingSet empty = new TrainingSet(new double[0][], new double[0], new String[0], List.of("a", "b"));

        assertThatThrownBy(() -> new BaggedEnsembler(2, 0.7, 1, SEED_ECHO)
            .fitAndPredict(empty, X_TEST, QUANTILES, REF_DATE, "02"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("02");
    }

    @Test
    void rejectsBagWithoutSeasons() {
        TrainingSet oneSeason = new TrainingSet(new double[][] {{0, 0}}, new double[] {1}, new String[] {"s"},
            List.of("a", "b"));

        assertThatThrownBy(() -> new BaggedEnsembler(2, 0.5, 1, SEED_ECHO)
            .fitAndPredict(oneSeason, X_TEST, QUANTILES, REF_DATE, "all"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("bag_frac_samples");
    }
}
