package net.visitorpool.core.spi;

import net.visitorpool.core.model.Lease;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** 리스 저장소. 모든 메서드는 진행 중인 트랜잭션 안에서 호출된다. */
public interface LeaseRepository {
    Lease insert(Lease lease) throws Exception;

    /** token 일치 + 활성 + 미만료 */
    Optional<Lease> findLiveByToken(String token, Instant now) throws Exception;

    Optional<Lease> findByToken(String token) throws Exception;

    /** FOR UPDATE */
    Optional<Lease> lockByToken(String token) throws Exception;

    /** 해당 identity 의 활성 리스 (만료 여부 무관) */
    List<Lease> findActiveByIdentity(int identityNumber) throws Exception;

    List<Lease> findAllActive() throws Exception;

    /** IS_ACTIVE 이고 EXPIRES_AT <= now (잠금 없음, 회수 후보 조회용) */
    List<Lease> findExpired(Instant now) throws Exception;

    /** 활성인 경우에만 비활성화. 반영 건수(0/1) 반환 */
    int deactivate(long leaseId, Instant at, Lease.EndReason reason) throws Exception;

    int countLive(Instant now) throws Exception;

    int countExpired(Instant now) throws Exception;
}
