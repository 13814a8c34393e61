package com.streamfirst.migration.adapters.jdbc;

import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.MigrationError;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationPhase;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.domain.TrafficWeight;
import com.streamfirst.migration.domain.VersionedState;
import com.streamfirst.migration.ports.WeightStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * JDBC implementation of WeightStorePort over the {@code migration_state} table. Compare-and-swap
 * is a single {@code UPDATE ... WHERE version = ?}; the row count tells whether the write won.
 * A lock or serialization failure on that row also means another writer got there first and
 * is reported as a conflict.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcWeightStoreAdapter implements WeightStorePort {

    static final String DDL = """
        CREATE TABLE IF NOT EXISTS migration_state (
            migration_id           VARCHAR(128) PRIMARY KEY,
            version                BIGINT       NOT NULL,
            phase                  VARCHAR(32)  NOT NULL,
            current_old_weight     INT          NOT NULL,
            current_new_weight     INT          NOT NULL,
            last_good_old_weight   INT          NOT NULL,
            last_good_new_weight   INT          NOT NULL,
            step_size              INT          NOT NULL,
            consecutive_good_polls INT          NOT NULL,
            created_at             TIMESTAMP    NOT NULL,
            updated_at             TIMESTAMP    NOT NULL
        )
        """;

    private static final String SELECT_COLUMNS = """
        SELECT migration_id, version, phase,
               current_old_weight, current_new_weight,
               last_good_old_weight, last_good_new_weight,
               step_size, consecutive_good_polls, created_at, updated_at
          FROM migration_state
        """;

    private static final RowMapper<VersionedState> ROW_MAPPER = (rs, n) -> {
        MigrationState state = new MigrationState(
                new MigrationId(rs.getString("migration_id")),
                MigrationPhase.valueOf(rs.getString("phase")),
                new TrafficWeight(rs.getInt("current_old_weight"), rs.getInt("current_new_weight")),
                new TrafficWeight(rs.getInt("last_good_old_weight"), rs.getInt("last_good_new_weight")),
                rs.getInt("step_size"),
                rs.getInt("consecutive_good_polls"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
        return new VersionedState(state, rs.getLong("version"));
    };

    private final JdbcTemplate jdbc;

    /**
     * Creates the state table if it does not exist yet.
     */
    public void ensureSchema() {
        jdbc.execute(DDL);
        log.info("migration_state table ready");
    }

    @Override
    public Optional<VersionedState> read(MigrationId migrationId) {
        try {
            List<VersionedState> rows = jdbc.query(SELECT_COLUMNS + " WHERE migration_id = ?",
                    ROW_MAPPER, migrationId.value());
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw unavailable("read", migrationId, e);
        }
    }

    @Override
    public Result<VersionedState> initialize(MigrationState s) {
        try {
            jdbc.update("""
                INSERT INTO migration_state
                  (migration_id, version, phase,
                   current_old_weight, current_new_weight,
                   last_good_old_weight, last_good_new_weight,
                   step_size, consecutive_good_polls, created_at, updated_at)
                VALUES (?, 1, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                s.getMigrationId().value(), s.getPhase().name(),
                s.getCurrentWeight().oldWeight(), s.getCurrentWeight().newWeight(),
                s.getLastGoodWeight().oldWeight(), s.getLastGoodWeight().newWeight(),
                s.getStepSize(), s.getConsecutiveGoodPolls(),
                Timestamp.from(s.getCreatedAt()), Timestamp.from(s.getUpdatedAt()));
        } catch (DuplicateKeyException e) {
            log.warn("State for {} already exists", s.getMigrationId());
            return Result.failure(MigrationError.conflict("State already initialized for " + s.getMigrationId()));
        } catch (DataAccessException e) {
            throw unavailable("initialize", s.getMigrationId(), e);
        }
        log.info("Initialized state for {} at version 1", s.getMigrationId());
        return Result.success(new VersionedState(s, 1L));
    }

    @Override
    public Result<VersionedState> compareAndSwap(MigrationId migrationId, long expectedVersion, MigrationState s) {
        int updated;
        try {
            updated = jdbc.update("""
                UPDATE migration_state
                   SET version = version + 1,
                       phase = ?,
                       current_old_weight = ?, current_new_weight = ?,
                       last_good_old_weight = ?, last_good_new_weight = ?,
                       step_size = ?, consecutive_good_polls = ?,
                       updated_at = ?
                 WHERE migration_id = ? AND version = ?
                """,
                s.getPhase().name(),
                s.getCurrentWeight().oldWeight(), s.getCurrentWeight().newWeight(),
                s.getLastGoodWeight().oldWeight(), s.getLastGoodWeight().newWeight(),
                s.getStepSize(), s.getConsecutiveGoodPolls(),
                Timestamp.from(s.getUpdatedAt()),
                migrationId.value(), expectedVersion);
        } catch (ConcurrencyFailureException e) {
            log.debug("CAS for {} at version {} lost a row lock: {}", migrationId, expectedVersion, e.getMessage());
            return Result.failure(MigrationError.conflict(
                    "Version " + expectedVersion + " of " + migrationId + " is being written concurrently"));
        } catch (DataAccessException e) {
            throw unavailable("compare-and-swap", migrationId, e);
        }
        if (updated == 0) {
            log.debug("CAS conflict for {} at version {}", migrationId, expectedVersion);
            return Result.failure(MigrationError.conflict(
                    "Version " + expectedVersion + " of " + migrationId + " is no longer current"));
        }
        return Result.success(new VersionedState(s, expectedVersion + 1));
    }

    @Override
    public List<MigrationState> findMatching(Predicate<MigrationState> predicate) {
        try {
            return jdbc.query(SELECT_COLUMNS, ROW_MAPPER).stream()
                    .map(VersionedState::state)
                    .filter(predicate)
                    .toList();
        } catch (DataAccessException e) {
            throw new CollaboratorUnavailableException("State store query failed", e);
        }
    }

    private static CollaboratorUnavailableException unavailable(String operation, MigrationId id, DataAccessException e) {
        log.warn("State store {} failed for {}: {}", operation, id, e.getMessage());
        return new CollaboratorUnavailableException("State store " + operation + " failed for " + id, e);
    }
}
