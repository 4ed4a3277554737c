package net.visitorpool.core.spi;

import net.visitorpool.core.model.VisitorIdentity;

import java.time.Instant;
import java.util.Optional;

public interface VisitorIdentityRepository {
    void insert(VisitorIdentity identity) throws Exception;

    Optional<VisitorIdentity> findByNumber(int number) throws Exception;

    /** 슬롯 단위 상호배제용 행 잠금 (SELECT ... FOR UPDATE) */
    Optional<VisitorIdentity> lockByNumber(int number) throws Exception;

    void repointWorkspace(int number, long workspaceId, Instant at) throws Exception;

    int count() throws Exception;
}
