package net.visitorpool.bootstrap.props;

import net.visitorpool.core.service.PoolSettings;
import net.visitorpool.integration.spring.web.BrowserCheck;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("visitor-pool")
public class VisitorPoolProperties {
    private int poolSize = PoolSettings.DEFAULT_POOL_SIZE;
    private Duration leaseLifetime = PoolSettings.DEFAULT_LEASE_LIFETIME;
    private Scheduler scheduler = new Scheduler();
    private Bootstrap bootstrap = new Bootstrap();
    private Session session = new Session();

    public PoolSettings toSettings() {
        return new PoolSettings(poolSize, leaseLifetime);
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public Duration getLeaseLifetime() {
        return leaseLifetime;
    }

    public void setLeaseLifetime(Duration leaseLifetime) {
        this.leaseLifetime = leaseLifetime;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Bootstrap getBootstrap() {
        return bootstrap;
    }

    public void setBootstrap(Bootstrap bootstrap) {
        this.bootstrap = bootstrap;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public static class Scheduler {
        private boolean enabled = true;
        // @Scheduled 가 같은 키를 직접 읽는다. 여기 있는 건 메타데이터/문서용
        private long reclaimDelayMs = 300_000;
        private long initialDelayMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getReclaimDelayMs() {
            return reclaimDelayMs;
        }

        public void setReclaimDelayMs(long reclaimDelayMs) {
            this.reclaimDelayMs = reclaimDelayMs;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }
    }

    public static class Bootstrap {
        /** 기동 시 1..poolSize identity 를 멱등 생성 */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Session {
        private boolean filterEnabled = true;
        private boolean requireBrowser = true;
        private List<String> botMarkers = new ArrayList<>(BrowserCheck.DEFAULT_BOT_MARKERS);
        private List<String> urlPatterns = new ArrayList<>(List.of("/*"));

        public boolean isFilterEnabled() {
            return filterEnabled;
        }

        public void setFilterEnabled(boolean filterEnabled) {
            this.filterEnabled = filterEnabled;
        }

        public boolean isRequireBrowser() {
            return requireBrowser;
        }

        public void setRequireBrowser(boolean requireBrowser) {
            this.requireBrowser = requireBrowser;
        }

        public List<String> getBotMarkers() {
            return botMarkers;
        }

        public void setBotMarkers(List<String> botMarkers) {
            this.botMarkers = botMarkers;
        }

        public List<String> getUrlPatterns() {
            return urlPatterns;
        }

        public void setUrlPatterns(List<String> urlPatterns) {
            this.urlPatterns = urlPatterns;
        }
    }
}
