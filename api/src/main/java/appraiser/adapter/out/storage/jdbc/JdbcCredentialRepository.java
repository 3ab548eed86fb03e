package appraiser.adapter.out.storage.jdbc;

import static appraiser.adapter.out.storage.jdbc.JdbcSupport.blocking;
import static appraiser.adapter.out.storage.jdbc.JdbcSupport.fromDb;
import static appraiser.adapter.out.storage.jdbc.JdbcSupport.toDb;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.auth.Credential;
import appraiser.core.model.auth.CredentialCollisionException;
import appraiser.core.model.auth.CredentialState;
import appraiser.core.model.auth.NewCredential;
import appraiser.core.port.out.CredentialRepository;

/**
 * JDBC implementation of CredentialRepository.
 *
 * <p>Table layout (see {@code db/schema.sql}):
 * <pre>
 * api_keys (
 *     id BIGINT AUTO_INCREMENT PRIMARY KEY,
 *     name, description,
 *     secret_hash UNIQUE, secret_prefix (indexed),
 *     active (indexed), created_at, updated_at, deactivated_at, deleted_at
 * )
 * </pre>
 *
 * <p>{@code active} is true only for {@link CredentialState#ACTIVE} so the prefix
 * lookup can use the index; {@code deactivated_at} remembers a deactivation across a
 * soft delete and restore.
 */
public class JdbcCredentialRepository implements CredentialRepository {

    private static final String COLUMNS =
            "id, name, description, secret_hash, secret_prefix, active, created_at, updated_at, deactivated_at, deleted_at";

    private static final String INSERT = "INSERT INTO api_keys "
            + "(name, description, secret_hash, secret_prefix, active, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, TRUE, ?, ?)";
    private static final String SELECT_BY_ID = "SELECT " + COLUMNS + " FROM api_keys WHERE id = ?";
    private static final String SELECT_USABLE_BY_PREFIX = "SELECT " + COLUMNS
            + " FROM api_keys WHERE secret_prefix = ? AND active = TRUE AND deleted_at IS NULL";
    private static final String SELECT_PAGE = "SELECT " + COLUMNS + " FROM api_keys ORDER BY id LIMIT ? OFFSET ?";
    private static final String SELECT_LIVE_PAGE =
            "SELECT " + COLUMNS + " FROM api_keys WHERE deleted_at IS NULL ORDER BY id LIMIT ? OFFSET ?";
    private static final String UPDATE_STATE =
            "UPDATE api_keys SET active = ?, updated_at = ?, deactivated_at = ?, deleted_at = ? WHERE id = ?";
    private static final String DELETE = "DELETE FROM api_keys WHERE id = ?";

    private final DataSource dataSource;

    public JdbcCredentialRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Uni<Credential> create(NewCredential credential) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(INSERT, Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, credential.name());
                ps.setString(2, credential.description());
                ps.setString(3, credential.secretHash());
                ps.setString(4, credential.secretPrefix());
                ps.setObject(5, toDb(credential.createdAt()));
                ps.setObject(6, toDb(credential.createdAt()));
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No identity generated for api_keys insert");
                    }
                    return credential.withId(keys.getLong(1));
                }
            } catch (SQLException e) {
                if (JdbcSupport.UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw new CredentialCollisionException("Secret hash already stored", e);
                }
                throw e;
            }
        });
    }

    @Override
    public Uni<Optional<Credential>> findById(long id) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(SELECT_BY_ID)) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<Credential>empty();
                }
            }
        });
    }

    @Override
    public Uni<List<Credential>> findUsableByPrefix(String secretPrefix) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(SELECT_USABLE_BY_PREFIX)) {
                ps.setString(1, secretPrefix);
                return readAll(ps);
            }
        });
    }

    @Override
    public Uni<List<Credential>> findAll(int skip, int limit, boolean includeDeleted) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(includeDeleted ? SELECT_PAGE : SELECT_LIVE_PAGE)) {
                ps.setInt(1, limit);
                ps.setInt(2, skip);
                return readAll(ps);
            }
        });
    }

    @Override
    public Uni<Boolean> update(Credential credential) {
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(UPDATE_STATE)) {
                ps.setBoolean(1, credential.state() == CredentialState.ACTIVE);
                ps.setObject(2, toDb(credential.updatedAt()));
                ps.setObject(3, toDb(credential.deactivatedAt()));
                ps.setObject(4, toDb(credential.deletedAt()));
                ps.setLong(5, credential.id());
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public Uni<Boolean> hardDelete(long id) {
        // prediction_logs.api_key_id is ON DELETE SET NULL
        return blocking(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement ps = connection.prepareStatement(DELETE)) {
                ps.setLong(1, id);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private List<Credential> readAll(PreparedStatement ps) throws SQLException {
        List<Credential> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(map(rs));
            }
        }
        return result;
    }

    private Credential map(ResultSet rs) throws SQLException {
        var deletedAt = fromDb(rs, "deleted_at");
        CredentialState state;
        if (deletedAt != null) {
            state = CredentialState.DELETED;
        } else if (rs.getBoolean("active")) {
            state = CredentialState.ACTIVE;
        } else {
            state = CredentialState.DEACTIVATED;
        }
        return new Credential(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("secret_hash"),
                rs.getString("secret_prefix"),
                state,
                fromDb(rs, "created_at"),
                fromDb(rs, "updated_at"),
                fromDb(rs, "deactivated_at"),
                deletedAt);
    }
}
