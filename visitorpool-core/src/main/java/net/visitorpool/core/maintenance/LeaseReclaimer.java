package net.visitorpool.core.maintenance;

import net.visitorpool.core.model.Lease;
import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.model.Workspace;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.LeaseRepository;
import net.visitorpool.core.spi.TxRunner;
import net.visitorpool.core.spi.VisitorIdentityRepository;
import net.visitorpool.core.spi.WorkspaceRepository;
import net.visitorpool.core.spi.WorkspaceResetHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 만료 리스 회수.
 * - 주기 스케줄러, 그리고 풀이 찼을 때 할당기가 인라인으로 호출
 * - 멱등: 다시 돌려도 새로 할 일이 없음
 */
public final class LeaseReclaimer {
    private static final Logger log = LoggerFactory.getLogger(LeaseReclaimer.class);

    private final LeaseRepository leases;
    private final VisitorIdentityRepository identities;
    private final WorkspaceRepository workspaces;
    private final WorkspaceResetHook resetHook;
    private final TxRunner tx;
    private final Clock clock;

    public LeaseReclaimer(LeaseRepository leases,
                          VisitorIdentityRepository identities,
                          WorkspaceRepository workspaces,
                          WorkspaceResetHook resetHook,
                          TxRunner tx,
                          Clock clock) {
        this.leases = leases;
        this.identities = identities;
        this.workspaces = workspaces;
        this.resetHook = resetHook;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * IS_ACTIVE && EXPIRES_AT <= now → 비활성화. 회수 건수 반환.
     * 할당기와 같은 identity 행 잠금 아래에서 확인-기록 하므로 같은 슬롯의 선점과 겹치지 않는다.
     * 워크스페이스 초기화 훅도 그 잠금이 풀리기 전에 돈다: 훅이 끝나기 전에는 누구도 슬롯을 다시 잡지 못한다.
     */
    public int reclaimExpired() throws Exception {
        Instant now = clock.now();
        List<Lease> candidates = tx.required(() -> leases.findExpired(now));

        Set<Integer> numbers = new LinkedHashSet<>();
        for (Lease l : candidates) numbers.add(l.identityNumber());

        int freed = 0;
        for (int number : numbers) {
            int n = tx.requiresNew(() -> reclaimIdentity(number, now));
            if (n == 0) continue;   // 동시 회수기/할당기가 먼저 처리
            freed += n;
            log.info("Freed expired slot: {}", VisitorIdentity.accountRefOf(number));
        }
        return freed;
    }

    private int reclaimIdentity(int number, Instant now) throws Exception {
        var identity = identities.lockByNumber(number);
        if (identity.isEmpty()) return 0;
        int n = 0;
        for (Lease l : leases.findActiveByIdentity(number)) {
            if (l.expiredAt(now)) n += leases.deactivate(l.id(), now, Lease.EndReason.EXPIRED);
        }
        if (n > 0) resetLocked(identity.get());
        return n;
    }

    /**
     * 회수된 슬롯의 워크스페이스 초기화 훅 호출.
     * 호출자는 현재 트랜잭션에서 해당 identity 행 잠금을 쥐고 있어야 한다.
     * 훅 실패는 로그만 남기고 회수/선점을 되돌리지 않는다.
     */
    public void resetLocked(VisitorIdentity identity) throws Exception {
        Optional<Workspace> ws = workspaces.findById(identity.workspaceId());
        if (ws.isEmpty()) {
            log.warn("Cannot reset workspace: {} has no workspace {}", identity.accountRef(), identity.workspaceId());
            return;
        }
        try {
            resetHook.onReclaim(identity, ws.get());
        } catch (Exception e) {
            log.warn("Workspace reset failed for {} (workspace {})", identity.accountRef(), ws.get().id(), e);
        }
    }
}
