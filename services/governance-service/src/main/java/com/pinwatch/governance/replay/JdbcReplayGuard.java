package com.pinwatch.governance.replay;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Replay guard backed by the {@code replay_window} table of a database shared by every service
 * instance. The primary key on {@code delivery_id} turns the insert into a set-if-absent; the
 * {@code state} column tells a pending reservation from a committed mark.
 */
public class JdbcReplayGuard implements ReplayGuard {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcReplayGuard.class);

    static final String PENDING = "PENDING";
    static final String COMMITTED = "COMMITTED";

    private static final String DELETE_EXPIRED_FOR_ID =
        "delete from replay_window where delivery_id = ? and expires_at <= ?";
    private static final String INSERT =
        "insert into replay_window (delivery_id, seen_at, expires_at, state) values (?, ?, ?, ?)";
    private static final String SELECT_STATE = "select state from replay_window where delivery_id = ?";
    private static final String UPDATE_COMMITTED =
        "update replay_window set state = ?, expires_at = ? where delivery_id = ?";
    private static final String DELETE_ID = "delete from replay_window where delivery_id = ?";
    private static final String DELETE_EXPIRED = "delete from replay_window where expires_at <= ?";

    private final JdbcTemplate jdbcTemplate;
    private final Duration window;
    private final Duration pendingLease;
    private final ReplayFailurePolicy failurePolicy;

    public JdbcReplayGuard(
        JdbcTemplate jdbcTemplate,
        Duration window,
        Duration pendingLease,
        ReplayFailurePolicy failurePolicy
    ) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.window = Objects.requireNonNull(window, "window");
        this.pendingLease = Objects.requireNonNull(pendingLease, "pendingLease");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    @Override
    public ReplayAdmission admit(String deliveryId, Instant now) {
        Objects.requireNonNull(deliveryId, "deliveryId");
        try {
            jdbcTemplate.update(DELETE_EXPIRED_FOR_ID, deliveryId, Timestamp.from(now));
            if (reserve(deliveryId, now)) {
                return ReplayAdmission.ADMITTED;
            }
            List<String> states = jdbcTemplate.queryForList(SELECT_STATE, String.class, deliveryId);
            return states.contains(COMMITTED) ? ReplayAdmission.DUPLICATE : ReplayAdmission.IN_FLIGHT;
        } catch (DataAccessException unreachable) {
            if (failurePolicy == ReplayFailurePolicy.FAIL_CLOSED) {
                throw new ReplayStoreUnavailableException("Replay store unavailable, rejecting delivery " + deliveryId, unreachable);
            }
            LOGGER.warn("Replay store unavailable, admitting delivery {} without dedup: {}", deliveryId, unreachable.getMessage());
            return ReplayAdmission.ADMITTED;
        }
    }

    private boolean reserve(String deliveryId, Instant now) {
        try {
            jdbcTemplate.update(INSERT, deliveryId, Timestamp.from(now), Timestamp.from(now.plus(pendingLease)), PENDING);
            return true;
        } catch (DuplicateKeyException held) {
            return false;
        }
    }

    @Override
    public void commit(String deliveryId, Instant now) {
        try {
            jdbcTemplate.update(UPDATE_COMMITTED, COMMITTED, Timestamp.from(now.plus(window)), deliveryId);
        } catch (DataAccessException ex) {
            LOGGER.warn("Could not commit replay entry {}; the recorded run still rejects repeats: {}",
                deliveryId, ex.getMessage());
        }
    }

    @Override
    public void release(String deliveryId) {
        try {
            jdbcTemplate.update(DELETE_ID, deliveryId);
        } catch (DataAccessException ex) {
            LOGGER.warn("Could not release replay entry {}; it lapses with the pending lease: {}", deliveryId, ex.getMessage());
        }
    }

    @Override
    public int sweep(Instant now) {
        return jdbcTemplate.update(DELETE_EXPIRED, Timestamp.from(now));
    }
}
