package idforecast.model;

import idforecast.config.BoosterParams;
import idforecast.config.Disease;
import idforecast.config.ModelConfig;
import idforecast.config.RunConfig;
import idforecast.data.ObservationCsvReader;
import idforecast.data.ObservationTable;
import idforecast.hub.HubRow;
import idforecast.hub.NoncrossingCorrector;
import idforecast.ml.FeatureImportance;
import idforecast.util.TestObservationFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GbqrModelTest {

    private static final List<String> NHSN = List.of("nhsn");
    private static final List<String> LOCATIONS = List.of("01", "02");
    private static final BoosterParams SMALL_BOOSTER = new BoosterParams(20, 0.1, 7, 10, 1.0);

    @TempDir
    Path tmp;

    private ModelConfig.Builder modelConfig() {
        return ModelConfig.builder("gbqr_test")
            .numBags(3)
            .bagFracSamples(0.7)
            .numThreads(2)
            .booster(SMALL_BOOSTER);
    }

    private RunConfig.Builder runConfig() {
        return RunConfig.builder()
            .refDate(TestObservationFactory.refDate())
            .disease(Disease.FLU)
            .maxHorizon(4)
            .quantiles(List.of(0.025, 0.5, 0.975), List.of("0.025", "0.5", "0.975"))
            .outputRoot(tmp);
    }

    @Test
    void writesHubFileUnderModelDirectory() throws IOException {
        Path out = new GbqrModel(modelConfig().build())
            .run(runConfig().build(), TestObservationFactory.table(NHSN, LOCATIONS, 4));

        assertThat(out).isEqualTo(tmp.resolve("UMass-gbqr_test").resolve("2022-12-17-UMass-gbqr_test.csv"));
        List<String> lines = Files.readAllLines(out);
        assertThat(lines.get(0))
            .isEqualTo("location,reference_date,horizon,target_end_date,target,output_type,output_type_id,value");
        assertThat(lines).hasSize(1 + LOCATIONS.size() * 4 * 3);
        assertThat(tmp.resolve("UMass-gbqr_test").resolve("feat_importance")).doesNotExist();
    }

    @Test
    void forecastsAreWellFormed() {
        RunConfig run = runConfig().build();
        List<HubRow> rows = new GbqrModel(modelConfig().build())
            .forecast(run, TestObservationFactory.table(NHSN, LOCATIONS, 4))
            .getHubRows();

        assertThat(rows).hasSize(LOCATIONS.size() * 4 * 3);
        assertThat(rows).extracting(HubRow::getLocation).containsOnly("01", "02");
        assertThat(rows).extracting(HubRow::getHorizon).containsOnly(0, 1, 2, 3);
        assertThat(rows).extracting(HubRow::getTarget).containsOnly("wk inc flu hosp");
        assertThat(rows).allSatisfy(r -> {
            assertThat(r.getValue()).isNotNegative();
            assertThat(r.getReferenceDate()).isEqualTo(run.getRefDate());
            assertThat(r.getTargetEndDate()).isEqualTo(run.getRefDate().plusWeeks(r.getHorizon()));
        });
        assertThat(NoncrossingCorrector.isNoncrossing(rows)).isTrue();
    }

    @Test
    void horizonsGetTheirOwnForecasts() {
        List<HubRow> rows = new GbqrModel(modelConfig().build())
            .forecast(runConfig().locations(List.of("01")).build(), TestObservationFactory.table(NHSN, LOCATIONS, 4))
            .getHubRows();

        assertThat(median(rows, 3)).isNotEqualTo(median(rows, 0));
    }

    private static double median(List<HubRow> rows, int horizon) {
        return rows.stream()
            .filter(r -> r.getHorizon() == horizon && r.getOutputTypeId().equals("0.5"))
            .mapToDouble(HubRow::getValue)
            .findFirst()
            .orElseThrow();
    }

    @Test
    void repeatedRunsAreIdentical() {
        ObservationTable table = TestObservationFactory.table(NHSN, LOCATIONS, 4);

        List<HubRow> first = new GbqrModel(modelConfig().numThreads(1).build()).forecast(runConfig().build(), table).getHubRows();
        List<HubRow> second = new GbqrModel(modelConfig().numThreads(3).build()).forecast(runConfig().build(), table).getHubRows();

        assertThat(second).containsExactlyElementsOf(first);
    }

    @Test
    void extraSourcesOnlyFeedTraining() {
        ObservationTable both = TestObservationFactory.table(List.of("nhsn", "flusurvnet"), LOCATIONS, 4);
        ObservationTable nhsnOnly = TestObservationFactory.table(NHSN, LOCATIONS, 4);

        List<HubRow> excluded = new GbqrModel(modelConfig().sources(NHSN).build())
            .forecast(runConfig().build(), both).getHubRows();
        List<HubRow> baseline = new GbqrModel(modelConfig().sources(NHSN).build())
            .forecast(runConfig().build(), nhsnOnly).getHubRows();
        List<HubRow> included = new GbqrModel(modelConfig().sources(List.of("nhsn", "flusurvnet")).build())
            .forecast(runConfig().build(), both).getHubRows();

        assertThat(excluded).containsExactlyElementsOf(baseline);
        assertThat(included).hasSameSizeAs(baseline);
    }

    @Test
    void locationFilterRestrictsOutput() {
        List<HubRow> rows = new GbqrModel(modelConfig().build())
            .forecast(runConfig().locations(List.of("02")).build(), TestObservationFactory.table(NHSN, LOCATIONS, 4))
            .getHubRows();

        assertThat(rows).hasSize(4 * 3).extracting(HubRow::getLocation).containsOnly("02");
    }

    @Test
    void fitsLocationsSeparatelyAndSavesImportance() throws IOException {
        Path artifacts = tmp.resolve("artifacts");
        RunConfig run = runConfig().artifactStoreRoot(artifacts).saveFeatImportance(true).build();
        ModelConfig config = modelConfig().fitLocationsSeparately(true).build();

        ForecastResult result = new GbqrModel(config).forecast(run, TestObservationFactory.table(NHSN, LOCATIONS, 4));
        new GbqrModel(config).run(run, TestObservationFactory.table(NHSN, LOCATIONS, 4));

        assertThat(result.getHubRows()).hasSize(LOCATIONS.size() * 4 * 3);
        assertThat(result.getFeatureImportance()).extracting(FeatureImportance::getLocation).containsOnly("01", "02");
        // 2 locations, 3 bags, 3 quantile levels, 6 features
        assertThat(result.getFeatureImportance()).hasSize(2 * 3 * 3 * 6);

        Path importance = artifacts.resolve("UMass-gbqr_test").resolve("feat_importance")
            .resolve("2022-12-17-UMass-gbqr_test.csv");
        List<String> lines = Files.readAllLines(importance);
        assertThat(lines.get(0)).isEqualTo("feat,importance,bag_index,quantile_level,location");
        assertThat(lines).hasSize(1 + 2 * 3 * 3 * 6);
    }

    @Test
    void jointFitLabelsImportanceForAllLocations() {
        ForecastResult result = new GbqrModel(modelConfig().build())
            .forecast(runConfig().build(), TestObservationFactory.table(NHSN, LOCATIONS, 4));

        assertThat(result.getFeatureImportance()).extracting(FeatureImportance::getLocation).containsOnly("all");
        assertThat(result.getFeatureImportance()).extracting(FeatureImportance::getFeature)
            .containsOnly("inc_trans_cs", "season_week", "log_pop", "inc_trans_cs_lag1", "inc_trans_cs_lag2", "horizon");
    }

    @Test
    void locationWithoutTargetsFailsSeparateFit() throws IOException {
        String csv = TestObservationFactory.csv(NHSN, List.of("01", "02"), 4);
        // blank out every delta_target of location 02
        String edited = csv.lines()
            .map(line -> {
                String[] cells = line.split(",", -1);
                if (cells[1].equals("02")) cells[10] = "NA";
                return String.join(",", cells);
            })
            .collect(Collectors.joining("\n"));
        ObservationTable table = ObservationCsvReader.read(new StringReader(edited));

        assertThatThrownBy(() -> new GbqrModel(modelConfig().fitLocationsSeparately(true).build())
            .forecast(runConfig().build(), table))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("location 02");
    }

    @Test
    void missingTargetSourceRowsFail() {
        ObservationTable table = TestObservationFactory.table(List.of("flusurvnet"), LOCATIONS, 4);

        assertThatThrownBy(() -> new GbqrModel(modelConfig().sources(List.of("flusurvnet", "nhsn")).build())
            .forecast(runConfig().build(), table))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("nhsn");
    }
}
