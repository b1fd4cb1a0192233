package idforecast.hub;

import idforecast.config.QuantileLevel;

import java.time.LocalDate;

/** A forecast count on the natural scale for one test row and quantile level. */
public final class CountForecast {

    private final String location;
    private final LocalDate wkEndDate;
    private final int horizon;
    private final QuantileLevel quantile;
    private final double value;

    public CountForecast(String location, LocalDate wkEndDate, int horizon, QuantileLevel quantile, double value) {
        this.location = location;
        this.wkEndDate = wkEndDate;
        this.horizon = horizon;
        this.quantile = quantile;
        this.value = value;
    }

    public String getLocation() { return location; }
    public LocalDate getWkEndDate() { return wkEndDate; }
    public int getHorizon() { return horizon; }
    public QuantileLevel getQuantile() { return quantile; }
    public double getValue() { return value; }
}
