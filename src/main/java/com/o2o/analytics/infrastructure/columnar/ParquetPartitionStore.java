package com.o2o.analytics.infrastructure.columnar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.o2o.analytics.domain.exception.EngineException;
import com.o2o.analytics.domain.exception.ErrorCodes;
import com.o2o.analytics.domain.model.FactRecord;
import com.o2o.analytics.domain.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parquet partition files written and read through an in-memory DuckDB connection.
 *
 * File layout (one file per day):
 * <pre>
 * record_id VARCHAR, order_id VARCHAR, store_id VARCHAR, channel VARCHAR,
 * category VARCHAR, order_date DATE, measures VARCHAR (JSON), updated_at BIGINT
 * </pre>
 */
@Slf4j
@Component
public class ParquetPartitionStore {

    private static final String DUCKDB_URL = "jdbc:duckdb:";
    private static final String DRIVER_CLASS = "org.duckdb.DuckDBDriver";

    private static final String CREATE_TABLE = "CREATE TABLE facts ("
            + "record_id VARCHAR, order_id VARCHAR, store_id VARCHAR, channel VARCHAR, "
            + "category VARCHAR, order_date DATE, measures VARCHAR, updated_at BIGINT)";

    private static final String INSERT = "INSERT INTO facts VALUES (?, ?, ?, ?, ?, CAST(? AS DATE), ?, ?)";

    private static final TypeReference<LinkedHashMap<String, Double>> MEASURES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ParquetPartitionStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public boolean driverAvailable() {
        try {
            Class.forName(DRIVER_CLASS);
            return true;
        } catch (ClassNotFoundException e) {
            log.warn("DuckDB driver not on classpath: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Writes {@code records} to a new Parquet file at {@code file}.
     */
    public void writePartition(Path file, List<FactRecord> records) {
        try {
            Files.createDirectories(file.getParent());
            try (Connection conn = DriverManager.getConnection(DUCKDB_URL)) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(CREATE_TABLE);
                }
                try (PreparedStatement ps = conn.prepareStatement(INSERT)) {
                    for (FactRecord record : records) {
                        ps.setObject(1, record.getRecordId());
                        ps.setObject(2, record.getOrderId());
                        ps.setObject(3, record.getStoreId());
                        ps.setObject(4, record.getChannel());
                        ps.setObject(5, record.getCategory());
                        ps.setObject(6, record.getOrderDate().toString());
                        ps.setObject(7, objectMapper.writeValueAsString(record.getMeasures()));
                        ps.setObject(8, record.getUpdatedAt() != null ? record.getUpdatedAt().toEpochMilli() : 0L);
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("COPY facts TO " + quoteLiteral(file.toAbsolutePath().toString()) + " (FORMAT PARQUET)");
                }
            }
            log.debug("Wrote {} rows to {}", records.size(), file);
        } catch (SQLException | IOException e) {
            throw new EngineException(ErrorCodes.ENGINE_FAILURE, "Failed to write partition " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads the rows of {@code files} inside the window that match every equality filter.
     *
     * @param filters dimension column to value; keys must be dimension fields
     */
    public List<FactRecord> read(List<Path> files, TimeWindow window, Map<String, String> filters) {
        if (files.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("SELECT record_id, order_id, store_id, channel, category, ")
                .append("CAST(order_date AS VARCHAR) AS order_date, measures, updated_at FROM read_parquet([");
        for (int i = 0; i < files.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(quoteLiteral(files.get(i).toAbsolutePath().toString()));
        }
        sql.append("]) WHERE order_date BETWEEN CAST(? AS DATE) AND CAST(? AS DATE)");
        List<String> params = new ArrayList<>();
        params.add(window.getStart().toString());
        params.add(window.getEnd().toString());
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            if (!FactRecord.DIMENSION_FIELDS.contains(filter.getKey())) {
                throw new IllegalArgumentException("Not a dimension column: " + filter.getKey());
            }
            sql.append(" AND ").append(filter.getKey()).append(" = ?");
            params.add(filter.getValue());
        }

        try (Connection conn = DriverManager.getConnection(DUCKDB_URL);
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            List<FactRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(FactRecord.builder()
                            .recordId(rs.getString("record_id"))
                            .orderId(rs.getString("order_id"))
                            .storeId(rs.getString("store_id"))
                            .channel(rs.getString("channel"))
                            .category(rs.getString("category"))
                            .orderDate(LocalDate.parse(rs.getString("order_date")))
                            .measures(objectMapper.readValue(rs.getString("measures"), MEASURES_TYPE))
                            .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")))
                            .build());
                }
            }
            return records;
        } catch (SQLException | JsonProcessingException e) {
            throw new EngineException(ErrorCodes.ENGINE_FAILURE, "Failed to read partitions: " + e.getMessage(), e);
        }
    }

    public Optional<SnapshotManifest> readManifest(Path path) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), SnapshotManifest.class));
        } catch (IOException e) {
            throw new EngineException(ErrorCodes.ENGINE_FAILURE, "Unreadable snapshot manifest " + path, e);
        }
    }

    /**
     * Replaces the manifest atomically: written next to the target, then moved over it.
     */
    public void writeManifest(Path path, SnapshotManifest manifest) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.createDirectories(path.getParent());
            objectMapper.writeValue(tmp.toFile(), manifest);
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new EngineException(ErrorCodes.ENGINE_FAILURE, "Failed to write snapshot manifest " + path, e);
        }
    }

    static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
