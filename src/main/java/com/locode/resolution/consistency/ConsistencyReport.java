package com.locode.resolution.consistency;

import com.locode.resolution.core.model.Code;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orphaned subdivision references, grouped by declared state and then by declared subdivision code.
 * An empty report means every subdivision reference resolves.
 */
public final class ConsistencyReport {

    private final Map<String, Map<String, List<Code>>> orphans;

    ConsistencyReport(Map<String, Map<String, List<Code>>> orphans) {
        Map<String, Map<String, List<Code>>> copy = new LinkedHashMap<>();
        orphans.forEach((state, bySubdivision) -> {
            Map<String, List<Code>> inner = new LinkedHashMap<>();
            bySubdivision.forEach((subdivision, codes) -> inner.put(subdivision, List.copyOf(codes)));
            copy.put(state, Collections.unmodifiableMap(inner));
        });
        this.orphans = Collections.unmodifiableMap(copy);
    }

    /**
     * State id to subdivision code to the codes referencing that missing subdivision.
     */
    public Map<String, Map<String, List<Code>>> getOrphans() {
        return orphans;
    }

    public boolean isConsistent() {
        return orphans.isEmpty();
    }

    public int orphanCount() {
        return orphans.values().stream()
                .flatMap(bySubdivision -> bySubdivision.values().stream())
                .mapToInt(List::size)
                .sum();
    }

    @Override
    public String toString() {
        return "ConsistencyReport{states=" + orphans.size() + ", orphans=" + orphanCount() + '}';
    }
}
