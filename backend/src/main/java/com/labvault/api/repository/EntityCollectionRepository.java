package com.labvault.api.repository;

import java.util.List;
import java.util.Map;

/**
 * Access to the business data captured by snapshots, one named collection at a time.
 * Records are plain column/value maps so snapshots stay independent of the entity model.
 */
public interface EntityCollectionRepository {

    /**
     * Collections included in every snapshot, in capture order.
     */
    List<String> collectionNames();

    List<Map<String, Object>> listEntities(String collectionName);

    /**
     * Replace the full content of a collection with the given records.
     *
     * @return number of records written
     */
    int replaceEntities(String collectionName, List<Map<String, Object>> records);
}
