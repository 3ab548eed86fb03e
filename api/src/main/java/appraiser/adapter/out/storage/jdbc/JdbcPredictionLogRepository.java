package appraiser.adapter.out.storage.jdbc;

import static appraiser.adapter.out.storage.jdbc.JdbcSupport.blocking;
import static appraiser.adapter.out.storage.jdbc.JdbcSupport.fromDb;
import static appraiser.adapter.out.storage.jdbc.JdbcSupport.toDb;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.sql.DataSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;

import appraiser.core.model.audit.PredictionLog;
import appraiser.core.model.audit.RequestType;
import appraiser.core.port.out.PredictionLogRepository;

/**
 * JDBC implementation of PredictionLogRepository.
 *
 * <p>Input features are stored as JSON text. {@code api_key_id} references
 * {@code api_keys} with {@code ON DELETE SET NULL}, so entries outlive their key.
 */
public class JdbcPredictionLogRepository implements PredictionLogRepository {

    private static final TypeReference<Map<String, Object>> FEATURES_TYPE = new TypeReference<>() {};

    private static final String COLUMNS =
            "id, api_key_id, input_features, predicted_price, response_time_ms, request_type, batch_id, created_at";

    private static final String INSERT = "INSERT INTO prediction_logs "
            + "(api_key_id, input_features, predicted_price, response_time_ms, request_type, batch_id, created_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT_BY_ID = "SELECT " + COLUMNS + " FROM prediction_logs WHERE id = ?";
    private static final String SELECT_BY_KEY = "SELECT " + COLUMNS
            + " FROM prediction_logs WHERE api_key_id = ? ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";
    private static final String SELECT_BY_BATCH =
            "SELECT " + COLUMNS + " FROM prediction_logs WHERE batch_id = ? ORDER BY id";
    private static final String COUNT_BY_KEY = "SELECT COUNT(*) FROM prediction_logs WHERE api_key_id = ?";
    private static final String COUNT_ALL = "SELECT COUNT(*) FROM prediction_logs";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcPredictionLogRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    @Override
    public Uni<PredictionLog> save(PredictionLog log) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection()) {
                return insert(connection, log);
            }
        });
    }

    @Override
    public Uni<List<PredictionLog>> saveAll(List<PredictionLog> logs) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection()) {
                boolean autoCommit = connection.getAutoCommit();
                connection.setAutoCommit(false);
                try {
                    List<PredictionLog> stored = new ArrayList<>(logs.size());
                    for (PredictionLog log : logs) {
                        stored.add(insert(connection, log));
                    }
                    connection.commit();
                    return stored;
                } catch (SQLException | RuntimeException e) {
                    connection.rollback();
                    throw e;
                } finally {
                    connection.setAutoCommit(autoCommit);
                }
            }
        });
    }

    @Override
    public Uni<Optional<PredictionLog>> findById(long id) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(SELECT_BY_ID)) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<PredictionLog>empty();
                }
            }
        });
    }

    @Override
    public Uni<List<PredictionLog>> findByApiKey(long apiKeyId, int skip, int limit) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(SELECT_BY_KEY)) {
                ps.setLong(1, apiKeyId);
                ps.setInt(2, limit);
                ps.setInt(3, skip);
                return readAll(ps);
            }
        });
    }

    @Override
    public Uni<List<PredictionLog>> findByBatchId(String batchId) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(SELECT_BY_BATCH)) {
                ps.setString(1, batchId);
                return readAll(ps);
            }
        });
    }

    @Override
    public Uni<Long> countByApiKey(long apiKeyId) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(COUNT_BY_KEY)) {
                ps.setLong(1, apiKeyId);
                return count(ps);
            }
        });
    }

    @Override
    public Uni<Long> countAll() {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(COUNT_ALL)) {
                return count(ps);
            }
        });
    }

    private PredictionLog insert(Connection connection, PredictionLog log) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(INSERT, Statement.RETURN_GENERATED_KEYS)) {
            if (log.apiKeyId() == null) {
                ps.setNull(1, Types.BIGINT);
            } else {
                ps.setLong(1, log.apiKeyId());
            }
            ps.setString(2, writeFeatures(log.inputFeatures()));
            ps.setDouble(3, log.predictedPrice());
            if (log.responseTimeMs() == null) {
                ps.setNull(4, Types.BIGINT);
            } else {
                ps.setLong(4, log.responseTimeMs());
            }
            ps.setString(5, log.requestType().value());
            ps.setString(6, log.batchId());
            ps.setObject(7, toDb(log.createdAt()));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No identity generated for prediction_logs insert");
                }
                return log.withId(keys.getLong(1));
            }
        }
    }

    private List<PredictionLog> readAll(PreparedStatement ps) throws SQLException {
        List<PredictionLog> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(map(rs));
            }
        }
        return result;
    }

    private long count(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private PredictionLog map(ResultSet rs) throws SQLException {
        long apiKeyId = rs.getLong("api_key_id");
        Long owner = rs.wasNull() ? null : apiKeyId;
        long responseTime = rs.getLong("response_time_ms");
        Long responseTimeMs = rs.wasNull() ? null : responseTime;
        return new PredictionLog(
                rs.getLong("id"),
                owner,
                readFeatures(rs.getString("input_features")),
                rs.getDouble("predicted_price"),
                responseTimeMs,
                RequestType.fromValue(rs.getString("request_type")),
                rs.getString("batch_id"),
                fromDb(rs, "created_at"));
    }

    private String writeFeatures(Map<String, Object> features) {
        try {
            return objectMapper.writeValueAsString(features);
        } catch (JsonProcessingException e) {
            throw new JdbcSupport.JdbcStorageException("Input features are not serializable", e);
        }
    }

    private Map<String, Object> readFeatures(String json) {
        try {
            return objectMapper.readValue(json, FEATURES_TYPE);
        } catch (JsonProcessingException e) {
            throw new JdbcSupport.JdbcStorageException("Stored input features are not valid JSON", e);
        }
    }
}
