package com.labvault.api.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of a backup: {@code metadata} plus one array of records per collection under
 * {@code data}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotDocument {

    private SnapshotMetadata metadata;

    @Builder.Default
    private Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();

    public int collectionCount() {
        return data != null ? data.size() : 0;
    }

    public long recordCount() {
        if (data == null) {
            return 0;
        }
        return data.values().stream()
                .mapToLong(records -> records != null ? records.size() : 0)
                .sum();
    }
}
