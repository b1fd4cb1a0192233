package idforecast.data;

import idforecast.config.Disease;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks the model's feature columns: the disease's base features, the engineered columns of the
 * table, then the forecast horizon. Lagged level features are a group that can be switched off.
 */
public final class FeatureSelector {

    public static final String HORIZON = "horizon";

    private static final Pattern LEVEL_FEATURE = Pattern.compile("inc_trans_cs_lag\\d+");

    private FeatureSelector() {
    }

    public static List<String> select(ObservationTable table, Disease disease, boolean inclLevelFeats) {
        List<String> names = new ArrayList<>();
        for (String base : disease.getBaseFeatures()) {
            if (!table.hasFeature(base)) {
                throw new IllegalStateException("base feature '" + base + "' missing for " + disease.getConfigName());
            }
            names.add(base);
        }
        for (String col : table.getFeatureColumns()) {
            if (names.contains(col)) continue;
            if (!inclLevelFeats && isLevelFeature(col)) continue;
            names.add(col);
        }
        // one row per (week, horizon): the horizon tells the trees which delta they predict
        names.add(HORIZON);
        return names;
    }

    public static boolean isLevelFeature(String name) {
        return LEVEL_FEATURE.matcher(name).matches();
    }
}
