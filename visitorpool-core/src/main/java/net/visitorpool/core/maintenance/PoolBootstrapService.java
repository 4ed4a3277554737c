package net.visitorpool.core.maintenance;

import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.model.Workspace;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.TxRunner;
import net.visitorpool.core.spi.VisitorIdentityRepository;
import net.visitorpool.core.spi.WorkspaceProvisioner;
import net.visitorpool.core.spi.WorkspaceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * 방문자 identity 풀 생성 (배포 시 1회).
 * 번호별로 멱등: 이미 있는 identity/워크스페이스/리스는 건드리지 않고 빠진 번호만 채운다.
 */
public final class PoolBootstrapService {
    private static final Logger log = LoggerFactory.getLogger(PoolBootstrapService.class);

    private final VisitorIdentityRepository identities;
    private final WorkspaceRepository workspaces;
    private final WorkspaceProvisioner provisioner;
    private final TxRunner tx;
    private final Clock clock;

    public PoolBootstrapService(VisitorIdentityRepository identities,
                                WorkspaceRepository workspaces,
                                WorkspaceProvisioner provisioner,
                                TxRunner tx,
                                Clock clock) {
        this.identities = identities;
        this.workspaces = workspaces;
        this.provisioner = provisioner;
        this.tx = tx;
        this.clock = clock;
    }

    /** 1..n 보장. 새로 만든 identity 수 반환 */
    public int initializePool(int n) throws Exception {
        if (n < 1) throw new IllegalArgumentException("pool size must be >= 1: " + n);

        int created = 0;
        for (int i = 1; i <= n; i++) {
            Optional<Created> c = createIfMissing(i);
            if (c.isEmpty()) continue;

            created++;
            log.info("Created visitor identity {} with workspace {}", c.get().identity().accountRef(), c.get().workspace().id());
            try {
                provisioner.provision(c.get().identity(), c.get().workspace());
            } catch (Exception e) {
                log.error("Failed to provision workspace {} for {}", c.get().workspace().id(), c.get().identity().accountRef(), e);
            }
        }

        int ready = tx.required(identities::count);
        if (created > 0) {
            log.info("Pool initialization complete: {} new visitor identities (pool size {}, {} registered)", created, n, ready);
        } else {
            log.info("Pool already initialized: {} visitor identities registered (pool size {})", ready, n);
        }
        return created;
    }

    /**
     * 번호 하나를 짧은 트랜잭션으로 생성.
     * 여러 인스턴스가 동시에 기동하면 같은 번호의 PK insert 가 부딪힌다. 진 쪽은 롤백되고,
     * 그 번호가 이미 등록돼 있으면 다른 인스턴스가 만든 것으로 보고 건너뛴다.
     */
    private Optional<Created> createIfMissing(int number) throws Exception {
        try {
            return tx.requiresNew(() -> {
                if (identities.findByNumber(number).isPresent()) return Optional.<Created>empty();

                Instant now = clock.now();
                String account = VisitorIdentity.accountRefOf(number);
                Workspace ws = workspaces.insert(account, Workspace.DEFAULT_SLUG, Workspace.DEFAULT_NAME, now);
                VisitorIdentity identity = new VisitorIdentity(number, account, ws.id(), now, now);
                identities.insert(identity);
                return Optional.of(new Created(identity, ws));
            });
        } catch (Exception e) {
            if (tx.requiresNew(() -> identities.findByNumber(number)).isEmpty()) throw e;
            log.info("Visitor identity {} was created concurrently, skipping", VisitorIdentity.accountRefOf(number));
            return Optional.empty();
        }
    }

    private record Created(VisitorIdentity identity, Workspace workspace) {}
}
