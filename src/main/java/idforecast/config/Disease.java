package idforecast.config;

import java.util.List;

/** Diseases with a published hub target. */
public enum Disease {

    FLU("flu", List.of("inc_trans_cs", "season_week", "log_pop"), 5, 45),
    COVID("covid", List.of("inc_trans_cs", "log_pop"), Integer.MIN_VALUE, Integer.MAX_VALUE);

    private final String configName;
    private final List<String> baseFeatures;
    private final int firstSeasonWeek;
    private final int lastSeasonWeek;

    Disease(String configName, List<String> baseFeatures, int firstSeasonWeek, int lastSeasonWeek) {
        this.configName = configName;
        this.baseFeatures = baseFeatures;
        this.firstSeasonWeek = firstSeasonWeek;
        this.lastSeasonWeek = lastSeasonWeek;
    }

    public static Disease fromConfig(String name) {
        for (Disease d : values()) {
            if (d.configName.equals(name)) return d;
        }
        throw new IllegalArgumentException("unsupported disease '" + name + "': must be \"flu\" or \"covid\"");
    }

    public String getConfigName() { return configName; }

    /** Features every model for this disease starts from. */
    public List<String> getBaseFeatures() { return baseFeatures; }

    /** Whether a season week falls in the modeled part of the season. */
    public boolean isInSeason(int seasonWeek) {
        return seasonWeek >= firstSeasonWeek && seasonWeek <= lastSeasonWeek;
    }

    /** Hub target name, e.g. "wk inc flu hosp". */
    public String hubTarget() {
        return "wk inc " + configName + " hosp";
    }
}
