package net.visitorpool.core.spi;

import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.model.Workspace;

/** 만료 회수된 슬롯의 워크스페이스 초기화 지점. 기본은 아무것도 하지 않음. */
@FunctionalInterface
public interface WorkspaceResetHook {
    void onReclaim(VisitorIdentity identity, Workspace workspace) throws Exception;

    static WorkspaceResetHook noop() { return (identity, workspace) -> { }; }
}
