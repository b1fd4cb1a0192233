package idforecast.ml;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Training rows of a sampled subset of whole seasons. */
public final class Bag {

    private final int index;
    private final Set<String> seasons;
    private final int[] rows;

    Bag(int index, Set<String> seasons, TrainingSet train) {
        this.index = index;
        this.seasons = Set.copyOf(seasons);
        List<Integer> inBag = new ArrayList<>();
        for (int i = 0; i < train.size(); i++) {
            if (seasons.contains(train.seasonOf(i))) inBag.add(i);
        }
        this.rows = inBag.stream().mapToInt(Integer::intValue).toArray();
    }

    static Bag draw(int index, TrainingSet train, List<String> distinctSeasons, int seasonsPerBag, SeedSequence seeds) {
        Set<String> chosen = new HashSet<>();
        for (int s : seeds.nextSample(distinctSeasons.size(), seasonsPerBag)) {
            chosen.add(distinctSeasons.get(s));
        }
        return new Bag(index, chosen, train);
    }

    public int getIndex() { return index; }
    public Set<String> getSeasons() { return seasons; }
    public int size() { return rows.length; }

    double[][] features(TrainingSet train) {
        double[][] all = train.getX();
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) out[i] = all[rows[i]];
        return out;
    }

    double[] targets(TrainingSet train) {
        double[] all = train.getY();
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) out[i] = all[rows[i]];
        return out;
    }
}
