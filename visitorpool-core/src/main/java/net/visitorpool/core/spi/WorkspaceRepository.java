package net.visitorpool.core.spi;

import net.visitorpool.core.model.Workspace;

import java.time.Instant;
import java.util.Optional;

public interface WorkspaceRepository {
    Workspace insert(String ownerRef, String slug, String name, Instant at) throws Exception;

    Optional<Workspace> findById(long id) throws Exception;

    Optional<Workspace> lockById(long id) throws Exception;

    /** 소유자 변경. 반영 건수 반환 */
    int changeOwner(long id, String newOwnerRef, Instant at) throws Exception;
}
