package net.visitorpool.core.model;

/**
 * allocate 결과. EXHAUSTED 는 예외가 아니라 정상 결과 중 하나.
 */
public record AllocationResult(
        Status status,
        VisitorIdentity identity,
        Workspace workspace,
        Lease lease
) {
    public enum Status { REUSED, ALLOCATED, EXHAUSTED }

    private static final AllocationResult EXHAUSTED = new AllocationResult(Status.EXHAUSTED, null, null, null);

    public static AllocationResult reused(VisitorIdentity identity, Workspace workspace, Lease lease) {
        return new AllocationResult(Status.REUSED, identity, workspace, lease);
    }

    public static AllocationResult allocated(VisitorIdentity identity, Workspace workspace, Lease lease) {
        return new AllocationResult(Status.ALLOCATED, identity, workspace, lease);
    }

    public static AllocationResult exhausted() {
        return EXHAUSTED;
    }

    public boolean isExhausted() {
        return status == Status.EXHAUSTED;
    }
}
