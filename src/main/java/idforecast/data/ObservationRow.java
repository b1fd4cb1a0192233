package idforecast.data;

import java.time.LocalDate;

/**
 * One engineered (source, location, week, horizon) record from the upstream feature builder.
 * Extra feature columns are held positionally; {@link ObservationTable} knows their names.
 */
public final class ObservationRow {

    private final String source;
    private final String location;
    private final LocalDate wkEndDate;
    private final String season;
    private final int seasonWeek;
    private final double pop;
    private final double incTransCs;
    private final double centerFactor;
    private final double scaleFactor;
    private final int horizon;
    /** Transformed signal at wkEndDate + horizon weeks minus the current one; NaN when not yet observed. */
    private final double deltaTarget;
    private final double[] extras;

    public ObservationRow(String source, String location, LocalDate wkEndDate, String season, int seasonWeek,
                          double pop, double incTransCs, double centerFactor, double scaleFactor,
                          int horizon, double deltaTarget, double[] extras) {
        this.source = source;
        this.location = location;
        this.wkEndDate = wkEndDate;
        this.season = season;
        this.seasonWeek = seasonWeek;
        this.pop = pop;
        this.incTransCs = incTransCs;
        this.centerFactor = centerFactor;
        this.scaleFactor = scaleFactor;
        this.horizon = horizon;
        this.deltaTarget = deltaTarget;
        this.extras = extras;
    }

    public String getSource() { return source; }
    public String getLocation() { return location; }
    public LocalDate getWkEndDate() { return wkEndDate; }
    public String getSeason() { return season; }
    public int getSeasonWeek() { return seasonWeek; }
    public double getPop() { return pop; }
    public double getIncTransCs() { return incTransCs; }
    public double getCenterFactor() { return centerFactor; }
    public double getScaleFactor() { return scaleFactor; }
    public int getHorizon() { return horizon; }
    public double getDeltaTarget() { return deltaTarget; }

    public boolean hasTarget() {
        return !Double.isNaN(deltaTarget);
    }

    double extra(int i) {
        return extras[i];
    }

    int extraCount() {
        return extras.length;
    }
}
