package net.visitorpool.integration.spring;

import net.visitorpool.adapter.jdbc.repo.JdbcLeaseRepository;
import net.visitorpool.adapter.jdbc.repo.JdbcVisitorIdentityRepository;
import net.visitorpool.adapter.jdbc.repo.JdbcWorkspaceRepository;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.LeaseRepository;
import net.visitorpool.core.spi.TokenGenerator;
import net.visitorpool.core.spi.TxRunner;
import net.visitorpool.core.spi.VisitorIdentityRepository;
import net.visitorpool.core.spi.WorkspaceProvisioner;
import net.visitorpool.core.spi.WorkspaceRepository;
import net.visitorpool.core.spi.WorkspaceResetHook;
import net.visitorpool.integration.spring.tx.SpringTxRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration(proxyBeanMethods = false)
public class VisitorPoolSpringConfig {

    @Bean
    @ConditionalOnMissingBean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public VisitorIdentityRepository visitorIdentityRepository(DataSource ds) { return new JdbcVisitorIdentityRepository(ds); }
    @Bean public LeaseRepository leaseRepository(DataSource ds) { return new JdbcLeaseRepository(ds); }
    @Bean public WorkspaceRepository workspaceRepository(DataSource ds) { return new JdbcWorkspaceRepository(ds); }

    @Bean
    @ConditionalOnMissingBean
    public Clock visitorPoolClock() { return Clock.system(); }

    @Bean
    @ConditionalOnMissingBean
    public TokenGenerator tokenGenerator() { return TokenGenerator.secureRandom(); }

    // 실물 준비/초기화는 앱이 빈으로 덮어쓴다
    @Bean
    @ConditionalOnMissingBean
    public WorkspaceProvisioner workspaceProvisioner() { return WorkspaceProvisioner.noop(); }

    @Bean
    @ConditionalOnMissingBean
    public WorkspaceResetHook workspaceResetHook() { return WorkspaceResetHook.noop(); }
}
