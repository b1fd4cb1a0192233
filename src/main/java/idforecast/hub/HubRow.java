package idforecast.hub;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/** One row of a hub quantile submission. */
public final class HubRow {

    public static final String OUTPUT_TYPE_QUANTILE = "quantile";

    public static final List<String> COLUMNS = List.of(
        "location", "reference_date", "horizon", "target_end_date", "target", "output_type", "output_type_id", "value");

    private final String location;
    private final LocalDate referenceDate;
    private final int horizon;
    private final LocalDate targetEndDate;
    private final String target;
    private final String outputType;
    private final String outputTypeId;
    private final double value;

    public HubRow(String location, LocalDate referenceDate, int horizon, LocalDate targetEndDate, String target,
                  String outputType, String outputTypeId, double value) {
        this.location = location;
        this.referenceDate = referenceDate;
        this.horizon = horizon;
        this.targetEndDate = targetEndDate;
        this.target = target;
        this.outputType = outputType;
        this.outputTypeId = outputTypeId;
        this.value = value;
    }

    public String getLocation() { return location; }
    public LocalDate getReferenceDate() { return referenceDate; }
    public int getHorizon() { return horizon; }
    public LocalDate getTargetEndDate() { return targetEndDate; }
    public String getTarget() { return target; }
    public String getOutputType() { return outputType; }
    public String getOutputTypeId() { return outputTypeId; }
    public double getValue() { return value; }

    /** Same group, different quantile label and value. */
    public HubRow withQuantile(String outputTypeId, double value) {
        return new HubRow(location, referenceDate, horizon, targetEndDate, target, outputType, outputTypeId, value);
    }

    /** Key of the rows whose values must not cross. */
    public GroupKey groupKey() {
        return new GroupKey(this);
    }

    public static final class GroupKey {
        private final String location;
        private final LocalDate referenceDate;
        private final int horizon;
        private final LocalDate targetEndDate;
        private final String target;
        private final String outputType;

        private GroupKey(HubRow row) {
            this.location = row.location;
            this.referenceDate = row.referenceDate;
            this.horizon = row.horizon;
            this.targetEndDate = row.targetEndDate;
            this.target = row.target;
            this.outputType = row.outputType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof GroupKey)) return false;
            GroupKey k = (GroupKey) o;
            return horizon == k.horizon && location.equals(k.location) && referenceDate.equals(k.referenceDate)
                && targetEndDate.equals(k.targetEndDate) && target.equals(k.target) && outputType.equals(k.outputType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(location, referenceDate, horizon, targetEndDate, target, outputType);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HubRow)) return false;
        HubRow r = (HubRow) o;
        return groupKey().equals(r.groupKey()) && outputTypeId.equals(r.outputTypeId)
            && Double.compare(value, r.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupKey(), outputTypeId, value);
    }

    @Override
    public String toString() {
        return location + "," + referenceDate + "," + horizon + "," + targetEndDate + "," + target + ","
            + outputType + "," + outputTypeId + "," + value;
    }
}
