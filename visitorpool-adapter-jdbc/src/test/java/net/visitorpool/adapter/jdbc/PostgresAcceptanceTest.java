package net.visitorpool.adapter.jdbc;

import net.visitorpool.adapter.jdbc.repo.JdbcLeaseRepository;
import net.visitorpool.adapter.jdbc.repo.JdbcVisitorIdentityRepository;
import net.visitorpool.adapter.jdbc.repo.JdbcWorkspaceRepository;
import net.visitorpool.core.maintenance.LeaseReclaimer;
import net.visitorpool.core.maintenance.PoolBootstrapService;
import net.visitorpool.core.model.AllocationResult;
import net.visitorpool.core.service.OwnershipTransferService;
import net.visitorpool.core.service.PoolObserver;
import net.visitorpool.core.service.PoolSettings;
import net.visitorpool.core.service.VisitorAllocator;
import net.visitorpool.core.service.VisitorPool;
import net.visitorpool.core.session.MapVisitorSession;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.TokenGenerator;
import net.visitorpool.core.spi.WorkspaceProvisioner;
import net.visitorpool.core.spi.WorkspaceResetHook;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 실제 PostgreSQL 에서의 경합 검증. Docker 가 없으면 건너뛴다.
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresAcceptanceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @Test
    void concurrentAllocate_onPostgres_respectsPoolInvariant() throws Exception {
        DataSource ds = TestSupport.dataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        TestSupport.migrate(ds);
        try {
            var tx = new JdbcTxRunner(ds);
            var identities = new JdbcVisitorIdentityRepository(ds);
            var leases = new JdbcLeaseRepository(ds);
            var workspaces = new JdbcWorkspaceRepository(ds);
            var settings = new PoolSettings(4, Duration.ofHours(1));
            Clock clock = Clock.system();

            var reclaimer = new LeaseReclaimer(leases, identities, workspaces, WorkspaceResetHook.noop(), tx, clock);
            var pool = new VisitorPool(
                    new VisitorAllocator(identities, leases, workspaces, reclaimer, TokenGenerator.secureRandom(), tx, clock, settings),
                    reclaimer,
                    new OwnershipTransferService(identities, leases, workspaces, WorkspaceProvisioner.noop(), tx, clock),
                    new PoolObserver(leases, tx, clock, settings),
                    new PoolBootstrapService(identities, workspaces, WorkspaceProvisioner.noop(), tx, clock));
            assertEquals(4, pool.initializePool(4));

            ExecutorService workers = Executors.newFixedThreadPool(12);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<AllocationResult>> futures = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                var session = new MapVisitorSession("pg-" + i);
                futures.add(workers.submit(() -> { start.await(); return pool.allocate(session); }));
            }
            start.countDown();

            var granted = new ArrayList<Integer>();
            for (var f : futures) {
                var r = f.get(60, TimeUnit.SECONDS);
                if (!r.isExhausted()) granted.add(r.identity().number());
            }
            workers.shutdownNow();

            assertEquals(4, granted.size());
            assertEquals(4, new HashSet<>(granted).size());
            assertEquals(4, pool.status().allocated());
        } finally {
            if (ds instanceof com.zaxxer.hikari.HikariDataSource h) h.close();
        }
    }
}
