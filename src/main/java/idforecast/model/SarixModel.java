package idforecast.model;

import idforecast.config.ModelConfig;
import idforecast.config.QuantileLevel;
import idforecast.config.RunConfig;
import idforecast.config.SarixParams;
import idforecast.data.ObservationRow;
import idforecast.data.ObservationTable;
import idforecast.hub.HubFormatter;
import idforecast.hub.HubRow;
import idforecast.hub.NoncrossingCorrector;
import idforecast.hub.ScaleInverter;
import idforecast.hub.WidePrediction;
import idforecast.ml.Sarix;
import idforecast.ml.SeedSequence;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Seasonal autoregressive forecasts of the transformed signal, sampled and summarized into quantiles.
 * Shares inversion, formatting and noncrossing with {@link GbqrModel}.
 */
public class SarixModel extends ForecastModel {

    private static final Logger log = LoggerFactory.getLogger(SarixModel.class);

    private final ScaleInverter inverter;
    private final NoncrossingCorrector corrector = new NoncrossingCorrector();

    public SarixModel(ModelConfig config) {
        super(config);
        this.inverter = new ScaleInverter(config.getPowerTransform());
    }

    @Override
    public ForecastResult forecast(RunConfig runConfig, ObservationTable table) {
        String targetSource = config.getTargetSource();
        ObservationTable df = table.filterLocations(runConfig.getLocations())
            .filter(r -> r.getSource().equals(targetSource) && !Double.isNaN(r.getIncTransCs()));
        if (df.isEmpty()) {
            throw new IllegalStateException("no " + targetSource + " observations to fit");
        }

        // one observation per week; horizon copies of a week share the signal
        Map<String, TreeMap<LocalDate, ObservationRow>> byLocation = new LinkedHashMap<>();
        for (ObservationRow r : df.getRows()) {
            byLocation.computeIfAbsent(r.getLocation(), k -> new TreeMap<>()).putIfAbsent(r.getWkEndDate(), r);
        }
        Map<String, double[]> series = new LinkedHashMap<>();
        for (Map.Entry<String, TreeMap<LocalDate, ObservationRow>> e : byLocation.entrySet()) {
            series.put(e.getKey(), e.getValue().values().stream().mapToDouble(ObservationRow::getIncTransCs).toArray());
        }

        SarixParams sp = config.getSarix();
        Sarix pooled = config.isFitLocationsSeparately() ? null : fit(sp, new ArrayList<>(series.values()));
        SeedSequence seeds = SeedSequence.forReferenceDate(runConfig.getRefDate());
        List<QuantileLevel> quantiles = runConfig.getQuantiles();
        int maxHorizon = runConfig.getMaxHorizon();

        List<WidePrediction> wide = new ArrayList<>();
        for (Map.Entry<String, double[]> e : series.entrySet()) {
            Sarix model = pooled != null ? pooled : fit(sp, List.of(e.getValue()));
            double[][] paths = model.samplePaths(e.getValue(), maxHorizon, sp.getNumSamples(), seeds);
            ObservationRow current = byLocation.get(e.getKey()).lastEntry().getValue();
            for (int h = 1; h <= maxHorizon; h++) {
                double[] atHorizon = new double[paths.length];
                for (int k = 0; k < paths.length; k++) atHorizon[k] = paths[k][h - 1];
                double[] deltas = new double[quantiles.size()];
                Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
                percentile.setData(atHorizon);
                for (int q = 0; q < quantiles.size(); q++) {
                    deltas[q] = percentile.evaluate(quantiles.get(q).getLevel() * 100.0) - current.getIncTransCs();
                }
                wide.add(WidePrediction.of(current, h, deltas));
            }
        }
        log.info("Sampled {} paths for {} location(s) up to horizon {}", sp.getNumSamples(), series.size(), maxHorizon);

        HubFormatter formatter = new HubFormatter(runConfig.getRefDate(), runConfig.getDisease());
        List<HubRow> rows = formatter.format(inverter.invert(wide, quantiles));
        return new ForecastResult(corrector.correct(rows), List.of());
    }

    private static Sarix fit(SarixParams sp, List<double[]> series) {
        return new Sarix(sp.getP(), sp.getD(), sp.getSeasonalP(), sp.getSeasonalD(), sp.getSeasonPeriod(), series);
    }
}
