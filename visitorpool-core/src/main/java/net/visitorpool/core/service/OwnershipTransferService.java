package net.visitorpool.core.service;

import net.visitorpool.core.model.Lease;
import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.model.Workspace;
import net.visitorpool.core.session.SessionKeys;
import net.visitorpool.core.session.VisitorSession;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.LeaseRepository;
import net.visitorpool.core.spi.TxRunner;
import net.visitorpool.core.spi.VisitorIdentityRepository;
import net.visitorpool.core.spi.WorkspaceProvisioner;
import net.visitorpool.core.spi.WorkspaceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * 가입 시 방문자 워크스페이스를 새 계정으로 이전.
 *
 * <p>한 트랜잭션 안에서: 소유자 변경 + 리스 비활성화(CLAIMED) + 방문자 identity 에 새 기본 워크스페이스 연결.
 * 어느 단계든 실패하면 전부 롤백된다.
 */
public final class OwnershipTransferService {
    private static final Logger log = LoggerFactory.getLogger(OwnershipTransferService.class);

    private final VisitorIdentityRepository identities;
    private final LeaseRepository leases;
    private final WorkspaceRepository workspaces;
    private final WorkspaceProvisioner provisioner;
    private final TxRunner tx;
    private final Clock clock;

    public OwnershipTransferService(VisitorIdentityRepository identities,
                                    LeaseRepository leases,
                                    WorkspaceRepository workspaces,
                                    WorkspaceProvisioner provisioner,
                                    TxRunner tx,
                                    Clock clock) {
        this.identities = identities;
        this.leases = leases;
        this.workspaces = workspaces;
        this.provisioner = provisioner;
        this.tx = tx;
        this.clock = clock;
    }

    /** 이전된 워크스페이스 반환. 세션에 리스가 없거나 더 이상 유효하지 않으면 empty */
    public Optional<Workspace> claimOnSignup(VisitorSession session, String newAccountRef) throws Exception {
        if (newAccountRef == null || newAccountRef.isBlank()) {
            throw new IllegalArgumentException("newAccountRef is required");
        }
        String token = SessionKeys.token(session);
        if (token == null) {
            // 방문자 세션 없이 가입하는 평범한 경우
            log.debug("No visitor workspace to claim for {}", newAccountRef);
            return Optional.empty();
        }

        Instant now = clock.now();
        Optional<Transfer> done = tx.required(() -> transfer(token, newAccountRef, now));
        if (done.isEmpty()) return Optional.empty();

        SessionKeys.clear(session);
        Transfer t = done.get();
        log.info("Claimed workspace {} for {} (was {})", t.claimed().id(), newAccountRef, t.identity().accountRef());

        try {
            provisioner.provision(t.identity(), t.replacement());
        } catch (Exception e) {
            log.error("Failed to provision replacement workspace {} for {}", t.replacement().id(), t.identity().accountRef(), e);
        }
        return Optional.of(t.claimed());
    }

    private Optional<Transfer> transfer(String token, String newAccountRef, Instant now) throws Exception {
        // 잠금 순서는 할당기와 같게: identity → lease → workspace
        var seen = leases.findByToken(token);
        if (seen.isEmpty()) {
            log.warn("Transfer skipped: no lease for token {}", SessionKeys.abbreviate(token));
            return Optional.empty();
        }
        var identity = identities.lockByNumber(seen.get().identityNumber())
                .orElseThrow(() -> new IllegalStateException("identity missing: " + seen.get().identityNumber()));

        // 잠금 아래에서 생존 여부 재확인 (확인-이전 사이 만료 대비)
        var lease = leases.lockByToken(token);
        if (lease.isEmpty() || !lease.get().liveAt(now)) {
            log.warn("Transfer conflict: lease {} for {} is no longer active",
                    SessionKeys.abbreviate(token), identity.accountRef());
            return Optional.empty();
        }

        var ws = workspaces.lockById(identity.workspaceId())
                .orElseThrow(() -> new IllegalStateException("workspace missing: " + identity.workspaceId()));
        if (!ws.ownedBy(identity.accountRef())) {
            log.warn("Transfer conflict: workspace {} is owned by {}, not {}", ws.id(), ws.ownerRef(), identity.accountRef());
            return Optional.empty();
        }

        workspaces.changeOwner(ws.id(), newAccountRef, now);
        if (leases.deactivate(lease.get().id(), now, Lease.EndReason.CLAIMED) != 1) {
            throw new IllegalStateException("lease " + lease.get().id() + " changed under lock");
        }

        Workspace fresh = workspaces.insert(identity.accountRef(), Workspace.DEFAULT_SLUG, Workspace.DEFAULT_NAME, now);
        identities.repointWorkspace(identity.number(), fresh.id(), now);

        var claimed = workspaces.findById(ws.id()).orElseThrow();
        return Optional.of(new Transfer(identity, claimed, fresh));
    }

    private record Transfer(VisitorIdentity identity, Workspace claimed, Workspace replacement) {}
}
