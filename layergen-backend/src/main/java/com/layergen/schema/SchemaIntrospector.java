package com.layergen.schema;

import com.layergen.model.ColumnDefinition;
import com.layergen.model.TableSchema;
import com.layergen.model.TableSelectionPolicy;
import com.layergen.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads table, column and primary-key metadata through {@link DatabaseMetaData}.
 *
 * <p>All metadata of a run is read over a single connection which is closed before the method
 * returns; generation never holds it open.
 */
@Slf4j
@Service
public class SchemaIntrospector {

    /** PostgreSQL reports partitioned parents separately from their partitions. */
    private static final Set<String> TABLE_TYPES = Set.of("TABLE", "BASE TABLE", "PARTITIONED TABLE");

    private final SchemaDataSourceFactory dataSourceFactory;

    public SchemaIntrospector(SchemaDataSourceFactory dataSourceFactory) {
        this.dataSourceFactory = dataSourceFactory;
    }

    /**
     * Read every selected table, sorted by name.
     *
     * @param info connection descriptor
     * @param policy table selection policy
     * @return table snapshots in lexicographic order; empty if nothing matched
     * @throws SchemaConnectionException if the database cannot be reached or read
     */
    public List<TableSchema> introspect(JdbcConnectionInfo info, TableSelectionPolicy policy) {
        log.info("Introspecting schema: url={}, schema={}, selection={}", info.maskedUrl(), info.getSchema(), policy.describe());
        return withConnection(info, "introspect", conn -> {
            DatabaseMetaData md = conn.getMetaData();
            String catalog = conn.getCatalog();
            String schema = resolveSchema(conn, info);

            Map<String, String> tables = listBaseTables(md, catalog, schema);
            List<TableSchema> result = new ArrayList<>();
            for (Map.Entry<String, String> table : tables.entrySet()) {
                if (policy.matches(table.getKey())) {
                    result.add(readTable(md, catalog, schema, table.getKey(), table.getValue()));
                }
            }
            result.sort(Comparator.comparing(TableSchema::getName));
            log.info("Introspection finished: matched_tables={}, total_tables={}", result.size(), tables.size());
            return result;
        });
    }

    /**
     * List base table names starting with {@code prefix} (all tables for an empty prefix).
     *
     * @param info connection descriptor
     * @param prefix literal name prefix, may be null
     * @return sorted table names
     */
    public List<String> listTableNames(JdbcConnectionInfo info, String prefix) {
        String p = prefix != null ? prefix : "";
        return withConnection(info, "list", conn -> {
            Map<String, String> tables = listBaseTables(conn.getMetaData(), conn.getCatalog(), resolveSchema(conn, info));
            return tables.keySet().stream()
                    .filter(name -> name.startsWith(p))
                    .sorted()
                    .toList();
        });
    }

    /**
     * @return whether a valid connection can be opened
     */
    public boolean checkConnection(JdbcConnectionInfo info) {
        try {
            return withConnection(info, "check", conn -> conn.isValid(5));
        } catch (SchemaConnectionException e) {
            log.warn("Database connection check failed: url={}, error={}", info.maskedUrl(), e.getMessage());
            return false;
        }
    }

    public DatabaseInfo describeDatabase(JdbcConnectionInfo info) {
        DatabaseInfo.DatabaseInfoBuilder builder = DatabaseInfo.builder()
                .url(info.maskedUrl())
                .dbType(info.getDbType())
                .username(info.getUsername());
        try {
            return withConnection(info, "describe", conn -> {
                DatabaseMetaData md = conn.getMetaData();
                return builder.connected(true)
                        .productName(md.getDatabaseProductName())
                        .productVersion(md.getDatabaseProductVersion())
                        .build();
            });
        } catch (SchemaConnectionException e) {
            return builder.connected(false).error(e.getMessage()).build();
        }
    }

    private <T> T withConnection(JdbcConnectionInfo info, String purpose, SqlFunction<T> body) {
        try (HikariDataSource ds = dataSourceFactory.create(info, purpose);
             Connection conn = ds.getConnection()) {
            return body.apply(conn);
        } catch (SQLException e) {
            log.error("Schema source error: url={}, sql_state={}, error_code={}", info.maskedUrl(), e.getSQLState(), e.getErrorCode(), e);
            throw new SchemaConnectionException("Failed to read schema from " + info.maskedUrl() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Schema source unreachable: url={}", info.maskedUrl(), e);
            throw new SchemaConnectionException("Failed to connect to " + info.maskedUrl() + ": " + e.getMessage(), e);
        }
    }

    private String resolveSchema(Connection conn, JdbcConnectionInfo info) throws SQLException {
        if (info.getSchema() != null && !info.getSchema().isBlank()) {
            return info.getSchema();
        }
        return conn.getSchema();
    }

    /**
     * @return table name to table remarks, for base tables only
     */
    private Map<String, String> listBaseTables(DatabaseMetaData md, String catalog, String schema) throws SQLException {
        Map<String, String> tables = new LinkedHashMap<>();
        try (ResultSet rs = md.getTables(catalog, escape(md, schema), "%", null)) {
            while (rs.next()) {
                String type = rs.getString("TABLE_TYPE");
                if (!isBaseTable(type)) {
                    continue;
                }
                String remarks = rs.getString("REMARKS");
                tables.put(rs.getString("TABLE_NAME"), remarks != null ? remarks : "");
            }
        }
        return tables;
    }

    static boolean isBaseTable(String tableType) {
        return tableType != null && TABLE_TYPES.contains(tableType.toUpperCase());
    }

    private TableSchema readTable(DatabaseMetaData md, String catalog, String schema, String table, String remarks) throws SQLException {
        List<String> keyColumns = new ArrayList<>();
        try (ResultSet rs = md.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                keyColumns.add(rs.getString("COLUMN_NAME"));
            }
        }
        String primaryKey = null;
        if (keyColumns.size() == 1) {
            primaryKey = keyColumns.get(0);
        } else if (keyColumns.size() > 1) {
            log.warn("Composite primary key is not supported, treating as no primary key: table={}, columns={}", table, keyColumns);
        }

        List<ColumnRow> rows = new ArrayList<>();
        try (ResultSet rs = md.getColumns(catalog, escape(md, schema), escape(md, table), "%")) {
            while (rs.next()) {
                // the pattern may still match sibling tables on drivers that ignore the escape
                if (!table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                int size = rs.getInt("COLUMN_SIZE");
                Integer columnSize = rs.wasNull() ? null : size;
                String columnRemarks = rs.getString("REMARKS");
                String name = rs.getString("COLUMN_NAME");
                ColumnDefinition column = ColumnDefinition.builder()
                        .name(name)
                        .type(rs.getString("TYPE_NAME"))
                        .size(columnSize)
                        .nullable(rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls)
                        .primaryKey(name.equals(primaryKey))
                        .remarks(columnRemarks != null ? columnRemarks : "")
                        .build();
                rows.add(new ColumnRow(rs.getInt("ORDINAL_POSITION"), column));
            }
        }
        rows.sort(Comparator.comparingInt(ColumnRow::ordinal));

        TableSchema.TableSchemaBuilder builder = TableSchema.builder().name(table).remarks(remarks);
        rows.forEach(r -> builder.column(r.column()));
        TableSchema schemaSnapshot = builder.build();
        log.debug("Read table: table={}, columns={}, primary_key={}", table, rows.size(), primaryKey);
        return schemaSnapshot;
    }

    private String escape(DatabaseMetaData md, String name) throws SQLException {
        if (name == null) {
            return null;
        }
        String esc = md.getSearchStringEscape();
        if (esc == null || esc.isEmpty()) {
            return name;
        }
        return name.replace(esc, esc + esc).replace("_", esc + "_").replace("%", esc + "%");
    }

    private record ColumnRow(int ordinal, ColumnDefinition column) {
    }

    @FunctionalInterface
    private interface SqlFunction<T> {
        T apply(Connection conn) throws SQLException;
    }
}
