package appraiser.adapter.out.storage.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import javax.sql.DataSource;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

/**
 * Shared plumbing for the JDBC repositories.
 */
final class JdbcSupport {

    private static final Logger LOG = Logger.getLogger(JdbcSupport.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";
    static final String UNIQUE_VIOLATION = "23505";

    private JdbcSupport() {}

    /**
     * Unit of JDBC work that may throw.
     */
    @FunctionalInterface
    interface SqlWork<T> {
        T run() throws SQLException;
    }

    /**
     * Run blocking JDBC work on the worker pool.
     */
    static <T> Uni<T> blocking(SqlWork<T> work) {
        return Uni.createFrom()
                .item(() -> {
                    try {
                        return work.run();
                    } catch (SQLException e) {
                        throw new JdbcStorageException("Storage operation failed: " + e.getMessage(), e);
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    static OffsetDateTime toDb(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant fromDb(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    /**
     * Create tables and indexes if they do not exist.
     */
    static void applySchema(DataSource dataSource) {
        List<String> statements = loadSchema();
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
            LOG.infof("Applied %d schema statements from %s", statements.size(), SCHEMA_RESOURCE);
        } catch (SQLException e) {
            throw new JdbcStorageException("Failed to apply schema", e);
        }
    }

    private static List<String> loadSchema() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = loader.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new JdbcStorageException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            String script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return Arrays.stream(script.split(";"))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        } catch (IOException e) {
            throw new JdbcStorageException("Failed to read schema resource " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * Unchecked wrapper for JDBC failures.
     */
    static class JdbcStorageException extends RuntimeException {
        JdbcStorageException(String message) {
            super(message);
        }

        JdbcStorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
