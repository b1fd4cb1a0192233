package idforecast.hub;

import idforecast.config.Disease;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns count forecasts into hub rows. The published horizon is recomputed from the target end date
 * and the reference date rather than carried over from the features.
 */
public class HubFormatter {

    private final LocalDate referenceDate;
    private final String target;

    public HubFormatter(LocalDate referenceDate, Disease disease) {
        this.referenceDate = referenceDate;
        this.target = disease.hubTarget();
    }

    public List<HubRow> format(List<CountForecast> forecasts) {
        List<HubRow> rows = new ArrayList<>(forecasts.size());
        for (CountForecast f : forecasts) {
            LocalDate targetEndDate = f.getWkEndDate().plusDays(7L * f.getHorizon());
            rows.add(new HubRow(f.getLocation(), referenceDate, weeksAhead(targetEndDate), targetEndDate, target,
                HubRow.OUTPUT_TYPE_QUANTILE, f.getQuantile().getLabel(), f.getValue()));
        }
        return rows;
    }

    int weeksAhead(LocalDate targetEndDate) {
        long days = ChronoUnit.DAYS.between(referenceDate, targetEndDate);
        if (days % 7 != 0) {
            throw new IllegalStateException("target end date " + targetEndDate + " is not a whole number of weeks from reference date " + referenceDate);
        }
        return (int) (days / 7);
    }
}
