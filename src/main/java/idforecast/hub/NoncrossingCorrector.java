package idforecast.hub;

import idforecast.config.QuantileLevel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes quantile crossing by rank alignment.
 * <p>
 * Rows are grouped by (location, reference_date, horizon, target_end_date, target, output_type).
 * Within a group, labels sorted by quantile level are paired positionally with values sorted ascending,
 * so the k-th smallest value gets the k-th smallest label. Groups keep their order of first appearance.
 */
public class NoncrossingCorrector {

    public List<HubRow> correct(List<HubRow> rows) {
        Map<HubRow.GroupKey, List<HubRow>> groups = new LinkedHashMap<>();
        for (HubRow row : rows) {
            groups.computeIfAbsent(row.groupKey(), k -> new ArrayList<>()).add(row);
        }

        List<HubRow> out = new ArrayList<>(rows.size());
        for (List<HubRow> group : groups.values()) {
            List<String> labels = new ArrayList<>(group.size());
            double[] values = new double[group.size()];
            for (int i = 0; i < group.size(); i++) {
                labels.add(group.get(i).getOutputTypeId());
                values[i] = group.get(i).getValue();
            }
            labels.sort(QuantileLevel::compareLabels);
            Arrays.sort(values);

            HubRow template = group.get(0);
            for (int i = 0; i < labels.size(); i++) {
                out.add(template.withQuantile(labels.get(i), values[i]));
            }
        }
        return out;
    }

    /** Whether values never decrease as the quantile level increases within each group. */
    public static boolean isNoncrossing(List<HubRow> rows) {
        Map<HubRow.GroupKey, List<HubRow>> groups = new LinkedHashMap<>();
        for (HubRow row : rows) {
            groups.computeIfAbsent(row.groupKey(), k -> new ArrayList<>()).add(row);
        }
        for (List<HubRow> group : groups.values()) {
            List<HubRow> sorted = new ArrayList<>(group);
            sorted.sort(Comparator.comparing(HubRow::getOutputTypeId, QuantileLevel::compareLabels));
            for (int i = 1; i < sorted.size(); i++) {
                if (sorted.get(i).getValue() < sorted.get(i - 1).getValue()) return false;
            }
        }
        return true;
    }
}
