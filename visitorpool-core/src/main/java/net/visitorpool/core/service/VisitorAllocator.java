package net.visitorpool.core.service;

import net.visitorpool.core.maintenance.LeaseReclaimer;
import net.visitorpool.core.model.AllocationResult;
import net.visitorpool.core.model.Lease;
import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.model.Workspace;
import net.visitorpool.core.session.SessionKeys;
import net.visitorpool.core.session.VisitorSession;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.LeaseRepository;
import net.visitorpool.core.spi.TokenGenerator;
import net.visitorpool.core.spi.TxRunner;
import net.visitorpool.core.spi.VisitorIdentityRepository;
import net.visitorpool.core.spi.WorkspaceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 방문자 슬롯 할당/반납.
 *
 * <p>슬롯 선점은 identity 행 잠금(FOR UPDATE) 아래에서 "활성 리스 확인 → 리스 insert" 를
 * 한 트랜잭션으로 처리한다. 같은 identity 를 두고 경합하는 두 요청 중 하나만 성공한다.
 */
public final class VisitorAllocator {
    private static final Logger log = LoggerFactory.getLogger(VisitorAllocator.class);

    private final VisitorIdentityRepository identities;
    private final LeaseRepository leases;
    private final WorkspaceRepository workspaces;
    private final LeaseReclaimer reclaimer;
    private final TokenGenerator tokens;
    private final TxRunner tx;
    private final Clock clock;
    private final PoolSettings settings;

    public VisitorAllocator(VisitorIdentityRepository identities,
                            LeaseRepository leases,
                            WorkspaceRepository workspaces,
                            LeaseReclaimer reclaimer,
                            TokenGenerator tokens,
                            TxRunner tx,
                            Clock clock,
                            PoolSettings settings) {
        this.identities = identities;
        this.leases = leases;
        this.workspaces = workspaces;
        this.reclaimer = reclaimer;
        this.tokens = tokens;
        this.tx = tx;
        this.clock = clock;
        this.settings = settings;
    }

    public AllocationResult allocate(VisitorSession session) throws Exception {
        // 1) 이미 리스를 가진 세션이면 그대로 재사용 (쓰기 없음)
        var reused = reenter(session);
        if (reused.isPresent()) return reused.get();

        // 2) 가장 낮은 번호의 빈 슬롯 선점
        var claimed = claimFirstFree(session);

        // 3) 없으면 만료분 회수 후 한 번만 재시도
        if (claimed.isEmpty()) {
            int freed = reclaimer.reclaimExpired();
            if (freed > 0) log.info("Reclaimed {} expired slot(s) under pool pressure", freed);
            claimed = claimFirstFree(session);
        }
        if (claimed.isEmpty()) {
            log.warn("Visitor pool exhausted - all {} slots in use", settings.poolSize());
            return AllocationResult.exhausted();
        }

        Claim c = claimed.get();
        var result = AllocationResult.allocated(c.identity(), c.workspace(), c.lease());
        SessionKeys.bind(session, result);
        log.info("Allocated {} to session (expires {})", c.identity().accountRef(), c.lease().expiresAt());
        return result;
    }

    /** 세션의 리스를 조기 반납. 실제로 비활성화했으면 true. 세션 키는 항상 비운다. */
    public boolean release(VisitorSession session) throws Exception {
        String token = SessionKeys.token(session);
        if (token == null) return false;

        Instant now = clock.now();
        Optional<Lease> released = tx.required(() -> {
            var seen = leases.findByToken(token);
            if (seen.isEmpty() || !seen.get().active()) return Optional.<Lease>empty();
            // 리스 변경은 항상 identity 잠금 아래에서
            identities.lockByNumber(seen.get().identityNumber());
            var lease = leases.lockByToken(token);
            if (lease.isEmpty() || !lease.get().active()) return Optional.<Lease>empty();
            return leases.deactivate(lease.get().id(), now, Lease.EndReason.RELEASED) == 1
                    ? lease : Optional.<Lease>empty();
        });
        SessionKeys.clear(session);

        if (released.isPresent()) {
            log.info("Deallocated {}", VisitorIdentity.accountRefOf(released.get().identityNumber()));
            return true;
        }
        log.warn("Allocation not found for token: {}", SessionKeys.abbreviate(token));
        return false;
    }

    private Optional<AllocationResult> reenter(VisitorSession session) throws Exception {
        String token = SessionKeys.token(session);
        if (token == null) return Optional.empty();

        Instant now = clock.now();
        Optional<AllocationResult> r = tx.required(() -> {
            var lease = leases.findLiveByToken(token, now);
            if (lease.isEmpty()) return Optional.<AllocationResult>empty();

            var identity = identities.findByNumber(lease.get().identityNumber());
            if (identity.isEmpty()) return Optional.<AllocationResult>empty();

            return workspaces.findById(identity.get().workspaceId())
                    .map(ws -> AllocationResult.reused(identity.get(), ws, lease.get()));
        });

        if (r.isEmpty()) {
            log.warn("Invalid allocation token {}, clearing session and reallocating", SessionKeys.abbreviate(token));
            SessionKeys.clear(session);
        } else {
            log.debug("Reusing allocation: {}", r.get().identity().accountRef());
        }
        return r;
    }

    private Optional<Claim> claimFirstFree(VisitorSession session) throws Exception {
        for (int n = 1; n <= settings.poolSize(); n++) {
            final int number = n;
            // 슬롯마다 짧은 트랜잭션: 잠금은 확인-기록 구간에만 잡힌다
            Optional<Claim> c = tx.requiresNew(() -> tryClaim(number, session));
            if (c.isPresent()) return c;
        }
        return Optional.empty();
    }

    private Optional<Claim> tryClaim(int number, VisitorSession session) throws Exception {
        var identity = identities.lockByNumber(number);
        if (identity.isEmpty()) {
            log.error("Visitor slot {} is not in the identity registry (run initialize-pool)", number);
            return Optional.empty();
        }
        var ws = workspaces.findById(identity.get().workspaceId());
        if (ws.isEmpty()) {
            log.error("Visitor slot {} has no workspace {}", number, identity.get().workspaceId());
            return Optional.empty();
        }

        Instant now = clock.now();
        List<Lease> current = leases.findActiveByIdentity(number);
        for (Lease l : current) {
            if (l.liveAt(now)) return Optional.empty();
        }

        // 활성이지만 만료된 리스는 여기서 정리 (identity 당 활성 리스 1개 유지)
        int superseded = 0;
        for (Lease l : current) {
            superseded += leases.deactivate(l.id(), now, Lease.EndReason.EXPIRED);
        }
        // 새 리스가 보이기 전에, 잠금을 쥔 채로 이전 방문자의 워크스페이스를 초기화
        if (superseded > 0) reclaimer.resetLocked(identity.get());

        Lease lease = leases.insert(new Lease(
                null, number, tokens.next(), session.id(),
                now, now.plus(settings.leaseLifetime()),
                true, null, null));
        return Optional.of(new Claim(identity.get(), ws.get(), lease));
    }

    private record Claim(VisitorIdentity identity, Workspace workspace, Lease lease) {}
}
