package net.visitorpool.integration.spring.sched;

import net.visitorpool.core.service.VisitorPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/** 만료 리스 주기 회수. 한 번 실패해도 다음 주기는 돈다 */
public class VisitorPoolSchedulers {
    private static final Logger log = LoggerFactory.getLogger(VisitorPoolSchedulers.class);

    private final VisitorPool pool;

    public VisitorPoolSchedulers(VisitorPool pool) {
        this.pool = pool;
    }

    @Scheduled(fixedDelayString = "${visitor-pool.scheduler.reclaim-delay-ms:300000}",
               initialDelayString = "${visitor-pool.scheduler.initial-delay-ms:60000}")
    public void reclaim() {
        try {
            int freed = pool.reclaimExpired();
            if (freed > 0) log.info("Scheduled reclaim freed {} slot(s)", freed);
            else log.debug("Scheduled reclaim: nothing expired");
        } catch (Exception e) {
            log.warn("Scheduled reclaim failed, will retry next cycle", e);
        }
    }
}
