package idforecast.util;

import idforecast.config.PowerTransform;
import idforecast.data.ObservationCsvReader;
import idforecast.data.ObservationTable;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Random;

/**
 * Builds a small engineered feature table: weekly Saturdays from 2018-08-04, four full 52-week seasons and
 * the first 20 weeks of a fifth, with a seasonal peak per location.
 */
public final class TestObservationFactory {

    public static final LocalDate FIRST_WEEK = LocalDate.of(2018, 8, 4);
    public static final int FULL_SEASONS = 4;
    public static final int WEEKS_IN_LAST_SEASON = 20;
    public static final int NUM_WEEKS = FULL_SEASONS * 52 + WEEKS_IN_LAST_SEASON;

    private static final String HEADER = "source,location,wk_end_date,season,season_week,pop,inc_trans_cs,"
        + "inc_trans_center_factor,inc_trans_scale_factor,horizon,delta_target,log_pop,inc_trans_cs_lag1,inc_trans_cs_lag2";

    private TestObservationFactory() {
    }

    public static LocalDate lastWeek() {
        return FIRST_WEEK.plusWeeks(NUM_WEEKS - 1);
    }

    /** The Saturday after the last observed week. */
    public static LocalDate refDate() {
        return lastWeek().plusWeeks(1);
    }

    public static ObservationTable table(List<String> sources, List<String> locations, int maxHorizon) {
        try {
            return ObservationCsvReader.read(new StringReader(csv(sources, locations, maxHorizon)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String csv(List<String> sources, List<String> locations, int maxHorizon) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        PowerTransform transform = PowerTransform.FOURTH_ROOT;
        Random random = new Random(7);
        for (String source : sources) {
            for (int l = 0; l < locations.size(); l++) {
                String location = locations.get(l);
                double pop = 1_000_000.0 * (l + 1);
                double center = 0.3 + 0.1 * l;
                double scale = 1.5;
                double[] cs = new double[NUM_WEEKS];
                for (int t = 0; t < NUM_WEEKS; t++) {
                    int seasonWeek = t % 52 + 1;
                    double peak = 20.0 * (1 + 0.3 * l) * Math.exp(-Math.pow(seasonWeek - 26, 2) / 60.0);
                    double inc = 1.0 + peak + 0.5 * random.nextDouble();
                    cs[t] = transform.centerAndScale(transform.forward(inc), center, scale);
                }
                for (int t = 0; t < NUM_WEEKS; t++) {
                    int seasonIdx = t / 52;
                    String season = (2018 + seasonIdx) + "/" + String.format("%02d", (19 + seasonIdx) % 100);
                    for (int h = 1; h <= maxHorizon; h++) {
                        String delta = t + h < NUM_WEEKS ? Double.toString(cs[t + h] - cs[t]) : "NA";
                        sb.append(source).append(',')
                            .append(location).append(',')
                            .append(FIRST_WEEK.plusWeeks(t)).append(',')
                            .append(season).append(',')
                            .append(t % 52 + 1).append(',')
                            .append(pop).append(',')
                            .append(cs[t]).append(',')
                            .append(center).append(',')
                            .append(scale).append(',')
                            .append(h).append(',')
                            .append(delta).append(',')
                            .append(Math.log(pop)).append(',')
                            .append(t >= 1 ? Double.toString(cs[t - 1]) : "NA").append(',')
                            .append(t >= 2 ? Double.toString(cs[t - 2]) : "")
                            .append('\n');
                    }
                }
            }
        }
        return sb.toString();
    }
}
