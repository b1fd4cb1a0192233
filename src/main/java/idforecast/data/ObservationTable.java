package idforecast.data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Engineered observation rows plus the names of their extra feature columns.
 * Feature names are resolved to accessors once, when a feature matrix is built.
 */
public final class ObservationTable {

    private final List<String> featureColumns;
    private final List<ObservationRow> rows;

    public ObservationTable(List<String> featureColumns, List<ObservationRow> rows) {
        this.featureColumns = List.copyOf(featureColumns);
        this.rows = List.copyOf(rows);
        for (ObservationRow r : this.rows) {
            if (r.extraCount() != this.featureColumns.size()) {
                throw new IllegalStateException("row for " + r.getLocation() + " " + r.getWkEndDate()
                    + " has " + r.extraCount() + " feature values, expected " + this.featureColumns.size());
            }
        }
    }

    /** Extra feature columns supplied upstream, in file order. */
    public List<String> getFeatureColumns() { return featureColumns; }

    public List<ObservationRow> getRows() { return rows; }

    public boolean isEmpty() { return rows.isEmpty(); }

    public int size() { return rows.size(); }

    public ObservationTable filter(Predicate<ObservationRow> keep) {
        return new ObservationTable(featureColumns, rows.stream().filter(keep).collect(Collectors.toList()));
    }

    /** Keep only the given locations; null keeps everything. */
    public ObservationTable filterLocations(Collection<String> locations) {
        if (locations == null) return this;
        Set<String> wanted = new HashSet<>(locations);
        return filter(r -> wanted.contains(r.getLocation()));
    }

    public LocalDate latestWeekEndDate() {
        return rows.stream()
            .map(ObservationRow::getWkEndDate)
            .max(LocalDate::compareTo)
            .orElseThrow(() -> new IllegalStateException("no observations left after filtering"));
    }

    /**
     * Build a row-major feature matrix for the given rows. Unknown names are a data error.
     */
    public double[][] featureMatrix(List<ObservationRow> subset, List<String> featureNames) {
        List<ToDoubleFunction<ObservationRow>> accessors = new ArrayList<>(featureNames.size());
        for (String name : featureNames) accessors.add(accessor(name));
        double[][] x = new double[subset.size()][featureNames.size()];
        for (int i = 0; i < subset.size(); i++) {
            ObservationRow r = subset.get(i);
            for (int j = 0; j < accessors.size(); j++) {
                x[i][j] = accessors.get(j).applyAsDouble(r);
            }
        }
        return x;
    }

    public boolean hasFeature(String name) {
        return featureColumns.contains(name) || fixedAccessor(name) != null;
    }

    private ToDoubleFunction<ObservationRow> accessor(String name) {
        ToDoubleFunction<ObservationRow> fixed = fixedAccessor(name);
        if (fixed != null) return fixed;
        int idx = featureColumns.indexOf(name);
        if (idx < 0) throw new IllegalStateException("feature '" + name + "' is not a column of the observation table");
        return r -> r.extra(idx);
    }

    private static ToDoubleFunction<ObservationRow> fixedAccessor(String name) {
        switch (name) {
            case "inc_trans_cs": return ObservationRow::getIncTransCs;
            case "season_week": return ObservationRow::getSeasonWeek;
            case "pop": return ObservationRow::getPop;
            case "horizon": return ObservationRow::getHorizon;
            default: return null;
        }
    }
}
