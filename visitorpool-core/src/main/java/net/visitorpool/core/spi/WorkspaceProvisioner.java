package net.visitorpool.core.spi;

import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.model.Workspace;

/**
 * 기본 워크스페이스 실물(디렉터리, 템플릿 복제 등) 준비.
 * 커밋 이후에 호출되며 DB 트랜잭션에 참여하지 않는다.
 */
@FunctionalInterface
public interface WorkspaceProvisioner {
    void provision(VisitorIdentity identity, Workspace workspace) throws Exception;

    static WorkspaceProvisioner noop() { return (identity, workspace) -> { }; }
}
