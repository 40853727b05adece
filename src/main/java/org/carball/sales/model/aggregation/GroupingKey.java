package org.carball.sales.model.aggregation;

import org.carball.sales.model.record.SalesField;
import org.carball.sales.model.record.SalesRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Extracts a {@link GroupKey} from a record using one or more fields.
 */
public record GroupingKey(List<SalesField> fields) {

    public GroupingKey {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("A grouping key needs at least one field");
        }
        fields = List.copyOf(fields);
    }

    public static GroupingKey of(SalesField... fields) {
        return new GroupingKey(List.of(fields));
    }

    public GroupKey keyOf(SalesRecord record) {
        List<String> parts = new ArrayList<>(fields.size());
        for (SalesField field : fields) {
            parts.add(String.valueOf(field.valueOf(record)));
        }
        return new GroupKey(parts);
    }

    public List<String> columnLabels() {
        return fields.stream().map(SalesField::getColumnName).collect(Collectors.toList());
    }
}
