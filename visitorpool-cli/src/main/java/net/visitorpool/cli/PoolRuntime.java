package net.visitorpool.cli;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.visitorpool.adapter.jdbc.JdbcTxRunner;
import net.visitorpool.adapter.jdbc.repo.JdbcLeaseRepository;
import net.visitorpool.adapter.jdbc.repo.JdbcVisitorIdentityRepository;
import net.visitorpool.adapter.jdbc.repo.JdbcWorkspaceRepository;
import net.visitorpool.core.maintenance.LeaseReclaimer;
import net.visitorpool.core.maintenance.PoolBootstrapService;
import net.visitorpool.core.service.OwnershipTransferService;
import net.visitorpool.core.service.PoolObserver;
import net.visitorpool.core.service.PoolSettings;
import net.visitorpool.core.service.VisitorAllocator;
import net.visitorpool.core.service.VisitorPool;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.TokenGenerator;
import net.visitorpool.core.spi.WorkspaceProvisioner;
import net.visitorpool.core.spi.WorkspaceResetHook;
import org.flywaydb.core.Flyway;

/** 스프링 없이 풀을 조립한다. 관리 명령 한 번 동안만 산다 */
final class PoolRuntime implements AutoCloseable {
    static final String MIGRATIONS = "classpath:db/migration/visitorpool";

    private final HikariDataSource ds;
    private final VisitorPool pool;

    PoolRuntime(String jdbcUrl, String username, String password,
                PoolSettings settings, boolean migrate, Clock clock) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(jdbcUrl);
        cfg.setUsername(username);
        cfg.setPassword(password);
        cfg.setMaximumPoolSize(2);
        cfg.setConnectionTimeout(10_000);
        cfg.setPoolName("visitor-pool-cli");
        this.ds = new HikariDataSource(cfg);

        if (migrate) {
            Flyway.configure().dataSource(ds).locations(MIGRATIONS).load().migrate();
        }

        var tx = new JdbcTxRunner(ds);
        var identities = new JdbcVisitorIdentityRepository(ds);
        var leases = new JdbcLeaseRepository(ds);
        var workspaces = new JdbcWorkspaceRepository(ds);

        var reclaimer = new LeaseReclaimer(leases, identities, workspaces, WorkspaceResetHook.noop(), tx, clock);
        var allocator = new VisitorAllocator(identities, leases, workspaces, reclaimer,
                TokenGenerator.secureRandom(), tx, clock, settings);
        var transfer = new OwnershipTransferService(identities, leases, workspaces, WorkspaceProvisioner.noop(), tx, clock);
        var observer = new PoolObserver(leases, tx, clock, settings);
        var bootstrap = new PoolBootstrapService(identities, workspaces, WorkspaceProvisioner.noop(), tx, clock);
        this.pool = new VisitorPool(allocator, reclaimer, transfer, observer, bootstrap);
    }

    VisitorPool pool() {
        return pool;
    }

    @Override
    public void close() {
        ds.close();
    }
}
