package net.visitorpool.core.service;

import net.visitorpool.core.maintenance.LeaseReclaimer;
import net.visitorpool.core.maintenance.PoolBootstrapService;
import net.visitorpool.core.model.AllocationResult;
import net.visitorpool.core.model.PoolStatus;
import net.visitorpool.core.model.SlotView;
import net.visitorpool.core.model.Workspace;
import net.visitorpool.core.session.VisitorSession;

import java.util.List;
import java.util.Optional;

/** 세션 바인딩 계층/스케줄러/관리 도구가 쓰는 진입점 */
public final class VisitorPool {
    private final VisitorAllocator allocator;
    private final LeaseReclaimer reclaimer;
    private final OwnershipTransferService transfer;
    private final PoolObserver observer;
    private final PoolBootstrapService bootstrap;

    public VisitorPool(VisitorAllocator allocator,
                       LeaseReclaimer reclaimer,
                       OwnershipTransferService transfer,
                       PoolObserver observer,
                       PoolBootstrapService bootstrap) {
        this.allocator = allocator;
        this.reclaimer = reclaimer;
        this.transfer = transfer;
        this.observer = observer;
        this.bootstrap = bootstrap;
    }

    public AllocationResult allocate(VisitorSession session) throws Exception {
        return allocator.allocate(session);
    }

    public boolean release(VisitorSession session) throws Exception {
        return allocator.release(session);
    }

    public Optional<Workspace> claimOnSignup(VisitorSession session, String newAccountRef) throws Exception {
        return transfer.claimOnSignup(session, newAccountRef);
    }

    public int reclaimExpired() throws Exception {
        return reclaimer.reclaimExpired();
    }

    public PoolStatus status() throws Exception {
        return observer.status();
    }

    public List<SlotView> slots(VisitorSession session) throws Exception {
        return observer.slots(session);
    }

    public int initializePool(int n) throws Exception {
        return bootstrap.initializePool(n);
    }
}
