package idforecast.model;

import idforecast.config.Disease;
import idforecast.config.ModelConfig;
import idforecast.config.RunConfig;
import idforecast.data.FeatureSelector;
import idforecast.data.ObservationRow;
import idforecast.data.ObservationTable;
import idforecast.hub.HubFormatter;
import idforecast.hub.HubRow;
import idforecast.hub.NoncrossingCorrector;
import idforecast.hub.ScaleInverter;
import idforecast.hub.WidePrediction;
import idforecast.ml.BaggedEnsembler;
import idforecast.ml.EnsembleResult;
import idforecast.ml.FeatureImportance;
import idforecast.ml.GbmQuantileTrainer;
import idforecast.ml.QuantileTrainer;
import idforecast.ml.TrainingSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Gradient-boosted quantile regression: a bagged ensemble of per-quantile models predicting the change in
 * the transformed signal at each horizon, inverted to counts and published in hub format.
 */
public class GbqrModel extends ForecastModel {

    private static final Logger log = LoggerFactory.getLogger(GbqrModel.class);

    private final BaggedEnsembler ensembler;
    private final ScaleInverter inverter;
    private final NoncrossingCorrector corrector = new NoncrossingCorrector();

    public GbqrModel(ModelConfig config) {
        this(config, new GbmQuantileTrainer(config.getBooster()));
    }

    public GbqrModel(ModelConfig config, QuantileTrainer trainer) {
        super(config);
        this.ensembler = new BaggedEnsembler(config, trainer);
        this.inverter = new ScaleInverter(config.getPowerTransform());
    }

    @Override
    public ForecastResult forecast(RunConfig runConfig, ObservationTable table) {
        Disease disease = runConfig.getDisease();
        Set<String> sources = new HashSet<>(config.getSources());
        ObservationTable df = table.filterLocations(runConfig.getLocations())
            .filter(r -> sources.contains(r.getSource()));
        List<String> featureNames = FeatureSelector.select(df, disease, config.isInclLevelFeats());
        df = df.filter(r -> disease.isInSeason(r.getSeasonWeek()));

        LocalDate lastDate = df.latestWeekEndDate();
        String targetSource = config.getTargetSource();
        List<ObservationRow> test = df.getRows().stream()
            .filter(r -> r.getWkEndDate().equals(lastDate) && r.getSource().equals(targetSource))
            .collect(Collectors.toList());
        List<ObservationRow> train = df.getRows().stream()
            .filter(ObservationRow::hasTarget)
            .collect(Collectors.toList());
        if (test.isEmpty()) {
            throw new IllegalStateException("no " + targetSource + " rows on the latest week " + lastDate);
        }
        log.info("Forecasting {} from {} test rows ({}) and {} training rows with features {}",
            runConfig.getRefDate(), test.size(), lastDate, train.size(), featureNames);

        if (!config.isFitLocationsSeparately()) {
            return trainAndPredict(runConfig, df, train, test, featureNames, FeatureImportance.ALL_LOCATIONS);
        }

        List<ForecastResult> parts = new ArrayList<>();
        List<String> locations = test.stream().map(ObservationRow::getLocation).distinct().collect(Collectors.toList());
        for (String location : locations) {
            List<ObservationRow> locTrain = train.stream()
                .filter(r -> r.getLocation().equals(location))
                .collect(Collectors.toList());
            List<ObservationRow> locTest = test.stream()
                .filter(r -> r.getLocation().equals(location))
                .collect(Collectors.toList());
            if (locTrain.isEmpty()) {
                throw new IllegalStateException("empty training set for location " + location);
            }
            parts.add(trainAndPredict(runConfig, df, locTrain, locTest, featureNames, location));
        }
        return ForecastResult.concat(parts);
    }

    private ForecastResult trainAndPredict(RunConfig runConfig, ObservationTable df, List<ObservationRow> train,
                                           List<ObservationRow> test, List<String> featureNames, String location) {
        double[] y = new double[train.size()];
        String[] seasons = new String[train.size()];
        for (int i = 0; i < train.size(); i++) {
            y[i] = train.get(i).getDeltaTarget();
            seasons[i] = train.get(i).getSeason();
        }
        TrainingSet trainingSet = new TrainingSet(df.featureMatrix(train, featureNames), y, seasons, featureNames);
        double[][] xTest = df.featureMatrix(test, featureNames);

        EnsembleResult ensemble = ensembler.fitAndPredict(trainingSet, xTest, runConfig.getQuantiles(),
            runConfig.getRefDate(), location);

        List<WidePrediction> wide = new ArrayList<>(test.size());
        for (int i = 0; i < test.size(); i++) {
            wide.add(WidePrediction.of(test.get(i), ensemble.getPredictions()[i]));
        }
        HubFormatter formatter = new HubFormatter(runConfig.getRefDate(), runConfig.getDisease());
        List<HubRow> rows = formatter.format(inverter.invert(wide, runConfig.getQuantiles()));
        return new ForecastResult(corrector.correct(rows), ensemble.getFeatureImportance());
    }
}
