package net.visitorpool.adapter.jdbc;

import net.visitorpool.core.model.PoolStatus;
import net.visitorpool.core.model.SlotView;
import net.visitorpool.core.service.VisitorPool;
import net.visitorpool.core.session.MapVisitorSession;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoolObserverAcceptanceTest extends TestSupport {

    private VisitorPool pool;

    @BeforeEach
    void initPool() throws Exception {
        pool = newPool(4);
        pool.initializePool(4);
    }

    @Test
    void status_onEmptyPool() throws Exception {
        assertEquals(new PoolStatus(4, 0, 4, 0), pool.status());
    }

    @Test
    void slots_reportsAllocatedAndFree_andMarksCallerSlot() throws Exception {
        var mine = new MapVisitorSession("mine");
        pool.allocate(new MapVisitorSession("other"));
        pool.allocate(mine);
        clock.advance(Duration.ofMinutes(20));

        List<SlotView> slots = pool.slots(mine);

        assertEquals(4, slots.size());
        SlotView s1 = slots.get(0);
        assertEquals(SlotView.State.ALLOCATED, s1.state());
        assertEquals("visitor-001", s1.accountRef());
        assertEquals(40L, s1.minutesRemaining());
        assertFalse(s1.currentSession());

        SlotView s2 = slots.get(1);
        assertEquals(SlotView.State.ALLOCATED, s2.state());
        assertTrue(s2.currentSession());

        SlotView s3 = slots.get(2);
        assertEquals(SlotView.State.FREE, s3.state());
        assertNull(s3.accountRef());
        assertNull(s3.expiresAt());
        assertEquals(3, s3.number());
    }

    @Test
    void slots_treatsExpiredLeaseAsFree() throws Exception {
        pool.allocate(new MapVisitorSession("gone"));
        clock.advance(Duration.ofHours(3));

        assertEquals(SlotView.State.FREE, pool.slots(null).get(0).state());
        assertEquals(new PoolStatus(4, 0, 4, 1), pool.status());
    }
}
