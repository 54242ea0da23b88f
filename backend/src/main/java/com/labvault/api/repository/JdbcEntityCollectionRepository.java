package com.labvault.api.repository;

import com.labvault.api.util.NamingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads and replaces business collections straight from their tables.
 * A collection name maps to its snake_case table name ({@code stockEntries -> stock_entries}).
 * Column names are lower-cased in snapshots so documents are portable between databases.
 */
@Slf4j
@Repository
public class JdbcEntityCollectionRepository implements EntityCollectionRepository {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final List<String> collections;

    public JdbcEntityCollectionRepository(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            @Value("${backup.collections:users,patients,doctors,requests,request_analyses,results,analyses,products,suppliers,stock_entries,stock_outs,orders,order_items,system_config,modules,module_licenses}")
            List<String> collections) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.collections = collections.stream()
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
        this.collections.forEach(NamingUtils::toTableName);
    }

    @Override
    public List<String> collectionNames() {
        return collections;
    }

    @Override
    public List<Map<String, Object>> listEntities(String collectionName) {
        String table = NamingUtils.toTableName(collectionName);
        List<Map<String, Object>> rows = jdbcTemplate.queryForList("SELECT * FROM " + table);

        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            row.forEach((column, value) -> record.put(column.toLowerCase(Locale.ROOT), value));
            records.add(record);
        }
        log.debug("Read {} records from collection {}", records.size(), collectionName);
        return records;
    }

    @Override
    public int replaceEntities(String collectionName, List<Map<String, Object>> records) {
        String table = NamingUtils.toTableName(collectionName);
        Map<String, ColumnInfo> columns = describeTable(table);

        Integer written = transactionTemplate.execute(status -> {
            jdbcTemplate.update("DELETE FROM " + table);
            if (records == null || records.isEmpty()) {
                return 0;
            }

            // Column set is the union of keys over all records; a record without a key writes NULL there.
            Set<String> keys = new LinkedHashSet<>();
            for (Map<String, Object> record : records) {
                record.keySet().forEach(key -> keys.add(key.toLowerCase(Locale.ROOT)));
            }
            List<ColumnInfo> targetColumns = new ArrayList<>();
            for (String key : keys) {
                ColumnInfo column = columns.get(key);
                if (column == null) {
                    log.warn("Ignoring unknown column '{}' while restoring {}", key, table);
                    continue;
                }
                targetColumns.add(column);
            }
            if (targetColumns.isEmpty()) {
                throw new IllegalArgumentException("No restorable columns for collection " + collectionName);
            }

            String sql = buildInsert(table, targetColumns);
            int[] argTypes = targetColumns.stream().mapToInt(ColumnInfo::sqlType).toArray();
            List<Object[]> batch = new ArrayList<>(records.size());
            for (Map<String, Object> record : records) {
                Map<String, Object> normalized = new LinkedHashMap<>();
                record.forEach((key, value) -> normalized.put(key.toLowerCase(Locale.ROOT), value));
                Object[] args = new Object[targetColumns.size()];
                for (int i = 0; i < targetColumns.size(); i++) {
                    args[i] = normalized.get(targetColumns.get(i).key());
                }
                batch.add(args);
            }
            jdbcTemplate.batchUpdate(sql, batch, argTypes);
            return batch.size();
        });

        int count = written != null ? written : 0;
        log.info("Replaced collection {} with {} records", collectionName, count);
        return count;
    }

    private Map<String, ColumnInfo> describeTable(String table) {
        Map<String, ColumnInfo> columns = jdbcTemplate.query("SELECT * FROM " + table + " WHERE 1 = 0", rs -> {
            ResultSetMetaData metaData = rs.getMetaData();
            Map<String, ColumnInfo> result = new LinkedHashMap<>();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                String name = metaData.getColumnName(i);
                result.put(name.toLowerCase(Locale.ROOT),
                        new ColumnInfo(name, name.toLowerCase(Locale.ROOT), metaData.getColumnType(i)));
            }
            return result;
        });
        return columns != null ? columns : Map.of();
    }

    private String buildInsert(String table, List<ColumnInfo> columns) {
        StringBuilder names = new StringBuilder();
        StringBuilder placeholders = new StringBuilder();
        for (ColumnInfo column : columns) {
            if (names.length() > 0) {
                names.append(", ");
                placeholders.append(", ");
            }
            names.append(column.name());
            placeholders.append('?');
        }
        return "INSERT INTO " + table + " (" + names + ") VALUES (" + placeholders + ")";
    }

    private record ColumnInfo(String name, String key, int sqlType) {
    }
}
