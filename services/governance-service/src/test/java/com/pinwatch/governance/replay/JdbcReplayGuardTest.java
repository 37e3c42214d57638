package com.pinwatch.governance.replay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

class JdbcReplayGuardTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");
    private static final Duration WINDOW = Duration.ofSeconds(300);
    private static final Duration LEASE = Duration.ofSeconds(60);

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .setName("replay-" + UUID.randomUUID())
            .build();
        jdbcTemplate = new JdbcTemplate(database);
        jdbcTemplate.execute("create table replay_window ("
            + "delivery_id varchar(128) primary key, "
            + "seen_at timestamp not null, "
            + "expires_at timestamp not null, "
            + "state varchar(16) not null)");
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void suppressesCommittedRepeatsWithinWindowAcrossInstances() {
        JdbcReplayGuard first = guard(jdbcTemplate, ReplayFailurePolicy.FAIL_OPEN);
        JdbcReplayGuard second = guard(jdbcTemplate, ReplayFailurePolicy.FAIL_OPEN);

        assertEquals(ReplayAdmission.ADMITTED, first.admit("d-1", T0));
        first.commit("d-1", T0);

        assertEquals(ReplayAdmission.DUPLICATE, second.admit("d-1", T0.plusSeconds(10)));
        assertEquals(ReplayAdmission.DUPLICATE, first.admit("d-1", T0.plusSeconds(299)));
    }

    @Test
    void pendingReservationIsInFlightForOtherInstancesUntilLeaseLapses() {
        JdbcReplayGuard first = guard(jdbcTemplate, ReplayFailurePolicy.FAIL_OPEN);
        JdbcReplayGuard second = guard(jdbcTemplate, ReplayFailurePolicy.FAIL_OPEN);

        assertEquals(ReplayAdmission.ADMITTED, first.admit("d-1", T0));

        assertEquals(ReplayAdmission.IN_FLIGHT, second.admit("d-1", T0.plusSeconds(10)));
        assertEquals(ReplayAdmission.ADMITTED, second.admit("d-1", T0.plusSeconds(60)));
    }

    @Test
    void readmitsAfterWindowExpiry() {
        JdbcReplayGuard guard = guard(jdbcTemplate, ReplayFailurePolicy.FAIL_OPEN);

        guard.admit("d-1", T0);
        guard.commit("d-1", T0);

        assertEquals(ReplayAdmission.ADMITTED, guard.admit("d-1", T0.plusSeconds(300)));
        assertEquals(ReplayAdmission.IN_FLIGHT, guard.admit("d-1", T0.plusSeconds(301)));
    }

    @Test
    void releaseAndSweepRemoveRows() {
        JdbcReplayGuard guard = guard(jdbcTemplate, ReplayFailurePolicy.FAIL_OPEN);
        guard.admit("keep", T0.plusSeconds(100));
        guard.commit("keep", T0.plusSeconds(100));
        guard.admit("expire", T0);
        guard.commit("expire", T0);
        guard.admit("lapsed", T0);
        guard.admit("release", T0);

        guard.release("release");
        int swept = guard.sweep(T0.plusSeconds(350));

        assertEquals(2, swept);
        assertEquals(1, jdbcTemplate.queryForObject("select count(*) from replay_window", Integer.class));
        assertEquals(ReplayAdmission.ADMITTED, guard.admit("release", T0.plusSeconds(350)));
    }

    @Test
    void failOpenAdmitsWhenStoreIsUnreachable() {
        JdbcReplayGuard guard = guard(unreachableStore(), ReplayFailurePolicy.FAIL_OPEN);

        assertEquals(ReplayAdmission.ADMITTED, guard.admit("d-1", T0));
        guard.commit("d-1", T0);
        assertEquals(ReplayAdmission.ADMITTED, guard.admit("d-1", T0));
    }

    @Test
    void failClosedRejectsWhenStoreIsUnreachable() {
        JdbcReplayGuard guard = guard(unreachableStore(), ReplayFailurePolicy.FAIL_CLOSED);

        assertThrows(ReplayStoreUnavailableException.class, () -> guard.admit("d-1", T0));
    }

    private static JdbcReplayGuard guard(JdbcTemplate template, ReplayFailurePolicy policy) {
        return new JdbcReplayGuard(template, WINDOW, LEASE, policy);
    }

    private JdbcTemplate unreachableStore() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:h2:tcp://127.0.0.1:1/unreachable", "sa", "");
        return new JdbcTemplate(dataSource);
    }
}
