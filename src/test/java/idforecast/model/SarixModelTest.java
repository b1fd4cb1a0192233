package idforecast.model;

import idforecast.config.Disease;
import idforecast.config.ModelClass;
import idforecast.config.ModelConfig;
import idforecast.config.RunConfig;
import idforecast.config.SarixParams;
import idforecast.hub.HubRow;
import idforecast.hub.NoncrossingCorrector;
import idforecast.util.TestObservationFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SarixModelTest {

    private static final List<String> LOCATIONS = List.of("01", "02", "03");

    @TempDir
    Path tmp;

    private ModelConfig.Builder modelConfig() {
        return ModelConfig.builder("sarix_test")
            .modelClass(ModelClass.SARIX)
            .sarix(new SarixParams(2, 0, 0, 0, 1, 200));
    }

    private RunConfig run() {
        return RunConfig.builder()
            .refDate(TestObservationFactory.refDate())
            .disease(Disease.COVID)
            .maxHorizon(3)
            .quantiles(List.of(0.1, 0.5, 0.9), List.of("0.1", "0.5", "0.9"))
            .outputRoot(tmp)
            .saveFeatImportance(true)
            .build();
    }

    @Test
    void factoryPicksSarix() {
        assertThat(ForecastModels.create(modelConfig().build())).isInstanceOf(SarixModel.class);
        assertThat(ForecastModels.create(ModelConfig.builder("g").build())).isInstanceOf(GbqrModel.class);
    }

    @Test
    void pooledFitProducesNoncrossingCounts() {
        ForecastResult result = new SarixModel(modelConfig().build())
            .forecast(run(), TestObservationFactory.table(List.of("nhsn"), LOCATIONS, 3));

        List<HubRow> rows = result.getHubRows();
        assertThat(rows).hasSize(LOCATIONS.size() * 3 * 3);
        assertThat(rows).extracting(HubRow::getHorizon).containsOnly(0, 1, 2);
        assertThat(rows).extracting(HubRow::getTarget).containsOnly("wk inc covid hosp");
        assertThat(rows).allSatisfy(r -> assertThat(r.getValue()).isNotNegative());
        assertThat(NoncrossingCorrector.isNoncrossing(rows)).isTrue();
        assertThat(result.getFeatureImportance()).isEmpty();
    }

    @Test
    void ignoresOtherSources() {
        List<HubRow> mixed = new SarixModel(modelConfig().build())
            .forecast(run(), TestObservationFactory.table(List.of("nhsn", "ilinet"), LOCATIONS, 3)).getHubRows();
        List<HubRow> nhsn = new SarixModel(modelConfig().build())
            .forecast(run(), TestObservationFactory.table(List.of("nhsn"), LOCATIONS, 3)).getHubRows();

        assertThat(mixed).containsExactlyElementsOf(nhsn);
    }

    @Test
    void separateFitsAreReproducible() {
        ModelConfig config = modelConfig().fitLocationsSeparately(true).build();

        List<HubRow> first = new SarixModel(config)
            .forecast(run(), TestObservationFactory.table(List.of("nhsn"), LOCATIONS, 3)).getHubRows();
        List<HubRow> second = new SarixModel(config)
            .forecast(run(), TestObservationFactory.table(List.of("nhsn"), LOCATIONS, 3)).getHubRows();

        assertThat(first).hasSize(LOCATIONS.size() * 3 * 3).containsExactlyElementsOf(second);
    }

    @Test
    void failsWithoutTargetSource() {
        assertThatThrownBy(() -> new SarixModel(modelConfig().build())
            .forecast(run(), TestObservationFactory.table(List.of("ilinet"), LOCATIONS, 3)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("nhsn");
    }
}
