package net.visitorpool.bootstrap.autoconfigure;

import net.visitorpool.bootstrap.props.VisitorPoolProperties;
import net.visitorpool.core.maintenance.LeaseReclaimer;
import net.visitorpool.core.maintenance.PoolBootstrapService;
import net.visitorpool.core.service.OwnershipTransferService;
import net.visitorpool.core.service.PoolObserver;
import net.visitorpool.core.service.PoolSettings;
import net.visitorpool.core.service.VisitorAllocator;
import net.visitorpool.core.service.VisitorPool;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.LeaseRepository;
import net.visitorpool.core.spi.TokenGenerator;
import net.visitorpool.core.spi.TxRunner;
import net.visitorpool.core.spi.VisitorIdentityRepository;
import net.visitorpool.core.spi.WorkspaceProvisioner;
import net.visitorpool.core.spi.WorkspaceRepository;
import net.visitorpool.core.spi.WorkspaceResetHook;
import net.visitorpool.integration.spring.VisitorPoolSpringConfig;
import net.visitorpool.integration.spring.sched.VisitorPoolSchedulers;
import net.visitorpool.integration.spring.web.BrowserCheck;
import net.visitorpool.integration.spring.web.VisitorSessionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.Ordered;

import java.util.function.Predicate;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        FlywayAutoConfiguration.class})
@EnableConfigurationProperties(VisitorPoolProperties.class)
@Import(VisitorPoolSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class VisitorPoolAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(VisitorPoolAutoConfiguration.class);

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public PoolSettings poolSettings(VisitorPoolProperties props) {
        return props.toSettings();
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaseReclaimer leaseReclaimer(LeaseRepository leases,
                                         VisitorIdentityRepository identities,
                                         WorkspaceRepository workspaces,
                                         WorkspaceResetHook resetHook,
                                         TxRunner tx,
                                         Clock clock) {
        return new LeaseReclaimer(leases, identities, workspaces, resetHook, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public VisitorAllocator visitorAllocator(VisitorIdentityRepository identities,
                                             LeaseRepository leases,
                                             WorkspaceRepository workspaces,
                                             LeaseReclaimer reclaimer,
                                             TokenGenerator tokens,
                                             TxRunner tx,
                                             Clock clock,
                                             PoolSettings settings) {
        return new VisitorAllocator(identities, leases, workspaces, reclaimer, tokens, tx, clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public OwnershipTransferService ownershipTransferService(VisitorIdentityRepository identities,
                                                             LeaseRepository leases,
                                                             WorkspaceRepository workspaces,
                                                             WorkspaceProvisioner provisioner,
                                                             TxRunner tx,
                                                             Clock clock) {
        return new OwnershipTransferService(identities, leases, workspaces, provisioner, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public PoolObserver poolObserver(LeaseRepository leases, TxRunner tx, Clock clock, PoolSettings settings) {
        return new PoolObserver(leases, tx, clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public PoolBootstrapService poolBootstrapService(VisitorIdentityRepository identities,
                                                     WorkspaceRepository workspaces,
                                                     WorkspaceProvisioner provisioner,
                                                     TxRunner tx,
                                                     Clock clock) {
        return new PoolBootstrapService(identities, workspaces, provisioner, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public VisitorPool visitorPool(VisitorAllocator allocator,
                                   LeaseReclaimer reclaimer,
                                   OwnershipTransferService transfer,
                                   PoolObserver observer,
                                   PoolBootstrapService bootstrap) {
        return new VisitorPool(allocator, reclaimer, transfer, observer, bootstrap);
    }

    // --- 스케줄러 (주기는 visitor-pool.scheduler.reclaim-delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "visitor-pool.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public VisitorPoolSchedulers visitorPoolSchedulers(VisitorPool pool) {
        return new VisitorPoolSchedulers(pool);
    }

    // --- 기동 시 풀 준비 ---

    @Bean
    @ConditionalOnProperty(prefix = "visitor-pool.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner visitorPoolInitializer(VisitorPool pool, VisitorPoolProperties props) {
        return args -> {
            int created = pool.initializePool(props.getPoolSize());
            log.info("Visitor pool ready: size={} created={} lifetime={}",
                    props.getPoolSize(), created, props.getLeaseLifetime());
        };
    }

    // --- 세션 바인딩 필터 ---

    @Bean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnProperty(prefix = "visitor-pool.session", name = "filter-enabled", havingValue = "true", matchIfMissing = true)
    public FilterRegistrationBean<VisitorSessionFilter> visitorSessionFilter(VisitorPool pool,
                                                                             VisitorPoolProperties props) {
        var session = props.getSession();
        Predicate<String> browserCheck = session.isRequireBrowser()
                ? new BrowserCheck(session.getBotMarkers())
                : ua -> true;
        var filter = new VisitorSessionFilter(pool, browserCheck, r -> r.getUserPrincipal() == null);

        var reg = new FilterRegistrationBean<>(filter);
        reg.setUrlPatterns(session.getUrlPatterns());
        // 인증 필터 뒤에서 돌아야 로그인 사용자를 건너뛸 수 있다
        reg.setOrder(Ordered.LOWEST_PRECEDENCE - 100);
        return reg;
    }
}
