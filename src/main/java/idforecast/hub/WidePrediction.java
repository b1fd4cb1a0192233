package idforecast.hub;

import idforecast.data.ObservationRow;

import java.time.LocalDate;

/**
 * One test row with a predicted transformed delta per quantile level, plus what is needed to invert
 * the upstream transforms.
 */
public final class WidePrediction {

    private final String location;
    private final LocalDate wkEndDate;
    private final int horizon;
    private final double pop;
    private final double incTransCs;
    private final double centerFactor;
    private final double scaleFactor;
    private final double[] deltas;

    public WidePrediction(String location, LocalDate wkEndDate, int horizon, double pop, double incTransCs,
                          double centerFactor, double scaleFactor, double[] deltas) {
        this.location = location;
        this.wkEndDate = wkEndDate;
        this.horizon = horizon;
        this.pop = pop;
        this.incTransCs = incTransCs;
        this.centerFactor = centerFactor;
        this.scaleFactor = scaleFactor;
        this.deltas = deltas;
    }

    public static WidePrediction of(ObservationRow row, double[] deltas) {
        return of(row, row.getHorizon(), deltas);
    }

    public static WidePrediction of(ObservationRow row, int horizon, double[] deltas) {
        return new WidePrediction(row.getLocation(), row.getWkEndDate(), horizon, row.getPop(), row.getIncTransCs(),
            row.getCenterFactor(), row.getScaleFactor(), deltas);
    }

    public String getLocation() { return location; }
    public LocalDate getWkEndDate() { return wkEndDate; }
    public int getHorizon() { return horizon; }
    public double getPop() { return pop; }
    public double getIncTransCs() { return incTransCs; }
    public double getCenterFactor() { return centerFactor; }
    public double getScaleFactor() { return scaleFactor; }

    public double delta(int quantileIndex) {
        return deltas[quantileIndex];
    }
}
