package idforecast.config;

import java.math.BigDecimal;
import java.util.Objects;

/** A forecast probability level and the label it is published under. */
public final class QuantileLevel implements Comparable<QuantileLevel> {

    private final double level;
    private final String label;

    public QuantileLevel(double level, String label) {
        if (!(level > 0.0 && level < 1.0)) {
            throw new IllegalArgumentException("quantile level must be in (0, 1), got " + level);
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("quantile label required for level " + level);
        }
        this.level = level;
        this.label = label;
    }

    public double getLevel() { return level; }
    public String getLabel() { return label; }

    /** Numeric order of hub output_type_id labels, e.g. "0.05" before "0.1". */
    public static int compareLabels(String a, String b) {
        return new BigDecimal(a).compareTo(new BigDecimal(b));
    }

    @Override
    public int compareTo(QuantileLevel other) {
        return Double.compare(level, other.level);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuantileLevel)) return false;
        QuantileLevel that = (QuantileLevel) o;
        return Double.compare(level, that.level) == 0 && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, label);
    }

    @Override
    public String toString() {
        return label;
    }
}
