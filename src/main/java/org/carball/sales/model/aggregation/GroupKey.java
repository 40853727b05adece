package org.carball.sales.model.aggregation;

import java.util.List;

/**
 * Value of a (possibly composite) grouping key. Keys order component by component.
 */
public record GroupKey(List<String> parts) implements Comparable<GroupKey> {

    public GroupKey {
        parts = List.copyOf(parts);
    }

    public static GroupKey of(String... parts) {
        return new GroupKey(List.of(parts));
    }

    @Override
    public int compareTo(GroupKey other) {
        int common = Math.min(parts.size(), other.parts.size());
        for (int i = 0; i < common; i++) {
            int cmp = parts.get(i).compareTo(other.parts.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(parts.size(), other.parts.size());
    }

    @Override
    public String toString() {
        return String.join(" / ", parts);
    }
}
