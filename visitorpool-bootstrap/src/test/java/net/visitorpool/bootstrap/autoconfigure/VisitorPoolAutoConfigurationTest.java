package net.visitorpool.bootstrap.autoconfigure;

import net.visitorpool.core.service.PoolSettings;
import net.visitorpool.core.service.VisitorPool;
import net.visitorpool.core.session.MapVisitorSession;
import net.visitorpool.core.spi.Clock;
import net.visitorpool.core.spi.TxRunner;
import net.visitorpool.integration.spring.sched.VisitorPoolSchedulers;
import net.visitorpool.integration.spring.tx.SpringTxRunner;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class VisitorPoolAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    DataSourceTransactionManagerAutoConfiguration.class,
                    FlywayAutoConfiguration.class,
                    VisitorPoolAutoConfiguration.class))
            .withPropertyValues(
                    "spring.datasource.url=jdbc:h2:mem:autoconfig;MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
                    "spring.datasource.username=sa",
                    "spring.flyway.locations=classpath:db/migration/visitorpool");

    @Test
    void wires_pool_from_properties() {
        runner.withPropertyValues("visitor-pool.pool-size=6", "visitor-pool.lease-lifetime=PT30M")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(VisitorPool.class);
                    assertThat(ctx).hasSingleBean(VisitorPoolSchedulers.class);
                    assertThat(ctx.getBean(TxRunner.class)).isInstanceOf(SpringTxRunner.class);
                    assertThat(ctx.getBean(PoolSettings.class))
                            .isEqualTo(new PoolSettings(6, Duration.ofMinutes(30)));
                    assertThat(ctx).hasBean("visitorPoolInitializer");
                    assertThat(ctx.getBean("visitorPoolInitializer")).isInstanceOf(ApplicationRunner.class);
                });
    }

    @Test
    void scheduler_and_initializer_can_be_switched_off() {
        runner.withPropertyValues("visitor-pool.scheduler.enabled=false", "visitor-pool.bootstrap.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(VisitorPoolSchedulers.class);
                    assertThat(ctx).doesNotHaveBean("visitorPoolInitializer");
                    // 비웹 컨텍스트에는 필터도 없다
                    assertThat(ctx).doesNotHaveBean("visitorSessionFilter");
                });
    }

    @Test
    void application_clock_overrides_default_and_pool_works_end_to_end() {
        Instant fixed = Instant.parse("2026-03-01T09:00:00Z");
        runner.withPropertyValues("spring.datasource.url=jdbc:h2:mem:autoconfig_e2e;MODE=PostgreSQL;DB_CLOSE_DELAY=-1")
                .withBean(Clock.class, () -> () -> fixed)
                .run(ctx -> {
                    var pool = ctx.getBean(VisitorPool.class);
                    assertThat(pool.initializePool(2)).isEqualTo(2);

                    var result = pool.allocate(new MapVisitorSession("s-1"));
                    assertThat(result.identity().number()).isEqualTo(1);
                    assertThat(result.lease().expiresAt()).isEqualTo(fixed.plus(Duration.ofHours(1)));
                    assertThat(pool.status().allocated()).isEqualTo(1);
                });
    }
}
