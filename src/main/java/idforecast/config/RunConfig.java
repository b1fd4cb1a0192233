package idforecast.config;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable settings for one forecast run. Weekly forecasts are anchored on Saturdays.
 */
public final class RunConfig {

    public static final DayOfWeek ANCHOR_DAY = DayOfWeek.SATURDAY;

    private final LocalDate refDate;
    private final Disease disease;
    private final int maxHorizon;
    private final List<QuantileLevel> quantiles;
    private final List<String> locations;
    private final Path outputRoot;
    private final Path artifactStoreRoot;
    private final boolean saveFeatImportance;

    private RunConfig(Builder b) {
        if (b.disease == null) throw new IllegalArgumentException("disease required");
        if (b.maxHorizon < 1) throw new IllegalArgumentException("max_horizon must be >= 1");
        if (b.outputRoot == null) throw new IllegalArgumentException("output_root required");
        this.refDate = validateRefDate(b.refDate, LocalDate.now());
        this.disease = b.disease;
        this.maxHorizon = b.maxHorizon;
        this.quantiles = buildQuantiles(b.qLevels, b.qLabels);
        this.locations = b.locations == null ? null : List.copyOf(b.locations);
        this.outputRoot = b.outputRoot;
        this.artifactStoreRoot = b.artifactStoreRoot == null ? b.outputRoot : b.artifactStoreRoot;
        this.saveFeatImportance = b.saveFeatImportance;
    }

    /**
     * An explicit reference date must fall on the anchor day. Without one, the next anchor day
     * on or after {@code today} is used.
     */
    public static LocalDate validateRefDate(LocalDate refDate, LocalDate today) {
        if (refDate == null) {
            return today.with(TemporalAdjusters.nextOrSame(ANCHOR_DAY));
        }
        if (refDate.getDayOfWeek() != ANCHOR_DAY) {
            throw new IllegalArgumentException("ref_date must be a Saturday, got " + refDate + " (" + refDate.getDayOfWeek() + ")");
        }
        return refDate;
    }

    private static List<QuantileLevel> buildQuantiles(List<Double> levels, List<String> labels) {
        if (levels == null || levels.isEmpty()) throw new IllegalArgumentException("q_levels required");
        if (labels == null || labels.size() != levels.size()) {
            throw new IllegalArgumentException("q_labels must match q_levels one to one");
        }
        List<QuantileLevel> out = new ArrayList<>(levels.size());
        Set<String> seenLabels = new HashSet<>();
        for (int i = 0; i < levels.size(); i++) {
            String label = labels.get(i);
            if (label == null) throw new IllegalArgumentException("q_labels must not contain null");
            try {
                new BigDecimal(label);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("q_label '" + label + "' is not a number", e);
            }
            QuantileLevel q = new QuantileLevel(levels.get(i), label);
            if (!out.isEmpty() && q.getLevel() <= out.get(out.size() - 1).getLevel()) {
                throw new IllegalArgumentException("q_levels must be unique and ascending");
            }
            if (!seenLabels.add(q.getLabel())) {
                throw new IllegalArgumentException("duplicate q_label " + q.getLabel());
            }
            out.add(q);
        }
        return List.copyOf(out);
    }

    public static Builder builder() {
        return new Builder();
    }

    public LocalDate getRefDate() { return refDate; }
    public Disease getDisease() { return disease; }
    public int getMaxHorizon() { return maxHorizon; }
    public List<QuantileLevel> getQuantiles() { return quantiles; }
    /** Locations to forecast, or null for all locations in the data. */
    public List<String> getLocations() { return locations; }
    public Path getOutputRoot() { return outputRoot; }
    public Path getArtifactStoreRoot() { return artifactStoreRoot; }
    public boolean isSaveFeatImportance() { return saveFeatImportance; }

    public static final class Builder {
        private LocalDate refDate;
        private Disease disease;
        private int maxHorizon = 4;
        private List<Double> qLevels;
        private List<String> qLabels;
        private List<String> locations;
        private Path outputRoot;
        private Path artifactStoreRoot;
        private boolean saveFeatImportance;

        private Builder() {
        }

        public Builder refDate(LocalDate v) { this.refDate = v; return this; }
        public Builder disease(Disease v) { this.disease = v; return this; }
        public Builder maxHorizon(int v) { this.maxHorizon = v; return this; }
        public Builder quantiles(List<Double> levels, List<String> labels) { this.qLevels = levels; this.qLabels = labels; return this; }
        public Builder locations(List<String> v) { this.locations = v; return this; }
        public Builder outputRoot(Path v) { this.outputRoot = v; return this; }
        public Builder artifactStoreRoot(Path v) { this.artifactStoreRoot = v; return this; }
        public Builder saveFeatImportance(boolean v) { this.saveFeatImportance = v; return this; }

        public RunConfig build() {
            return new RunConfig(this);
        }
    }
}
