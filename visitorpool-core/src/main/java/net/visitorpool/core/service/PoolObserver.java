package net.visitorpool.core.service;

import net.visitorpool.core.model.Lease;
import net.visitorpool.core.model.PoolStatus;
import net.visitorpool.core.model.SlotView;
import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.session.SessionKeys;
import net.visitorpool.core.session.VisitorSession;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.LeaseRepository;
import net.visitorpool.core.spi.TxRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** 읽기 전용 풀 현황. 잠금 없음 */
public final class PoolObserver {
    private final LeaseRepository leases;
    private final TxRunner tx;
    private final Clock clock;
    private final PoolSettings settings;

    public PoolObserver(LeaseRepository leases, TxRunner tx, Clock clock, PoolSettings settings) {
        this.leases = leases;
        this.tx = tx;
        this.clock = clock;
        this.settings = settings;
    }

    public PoolStatus status() throws Exception {
        Instant now = clock.now();
        int total = settings.poolSize();
        int[] counts = tx.required(() -> new int[]{leases.countLive(now), leases.countExpired(now)});
        int allocated = counts[0];
        // 풀을 줄인 직후에는 allocated > total 일 수 있음
        return new PoolStatus(total, allocated, Math.max(0, total - allocated), counts[1]);
    }

    /** 번호별 슬롯 상태. session 이 null 이면 currentSession 은 모두 false */
    public List<SlotView> slots(VisitorSession session) throws Exception {
        Instant now = clock.now();
        String token = session == null ? null : SessionKeys.token(session);

        List<Lease> active = tx.required(leases::findAllActive);
        Map<Integer, Lease> live = new HashMap<>();
        for (Lease l : active) {
            if (l.liveAt(now)) live.put(l.identityNumber(), l);
        }

        List<SlotView> out = new ArrayList<>(settings.poolSize());
        for (int n = 1; n <= settings.poolSize(); n++) {
            Lease l = live.get(n);
            if (l == null) {
                out.add(new SlotView(n, SlotView.State.FREE, null, null, null, false));
            } else {
                long minutes = Duration.between(now, l.expiresAt()).toMinutes();
                out.add(new SlotView(n, SlotView.State.ALLOCATED, VisitorIdentity.accountRefOf(n),
                        l.expiresAt(), minutes, token != null && token.equals(l.token())));
            }
        }
        return out;
    }
}
