package net.visitorpool.integration.spring.tx;

import net.visitorpool.adapter.jdbc.TxContext;
import net.visitorpool.core.spi.StorageUnavailableException;
import net.visitorpool.core.spi.TxRunner;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 JDBC 저장소를 돌린다.
 * 스프링이 잡은 커넥션을 TxContext 에 꽂아 주므로 저장소 구현은 그대로 재사용된다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                // REQUIRED 중첩이면 바깥 커넥션을 그대로 사용
                Connection outer = TxContext.get();
                if (outer != null && propagation == TransactionDefinition.PROPAGATION_REQUIRED) {
                    return call(body);
                }

                // 스프링 트랜잭션의 물리 커넥션을 TxContext 에 꽂고, 끝나면 바깥 것을 복원
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    if (outer != null) TxContext.set(outer);
                    else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (BodyFailure f) {
            throw f.original;
        } catch (CannotGetJdbcConnectionException | CannotCreateTransactionException e) {
            throw new StorageUnavailableException("cannot obtain a connection to the lease store", e);
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            // 롤백은 런타임 예외로만 걸리므로 잠시 감쌌다가 밖에서 원래 예외로 되돌린다
            throw new BodyFailure(e);
        }
    }

    private static final class BodyFailure extends RuntimeException {
        private final Exception original;

        BodyFailure(Exception cause) {
            super(cause);
            this.original = cause;
        }
    }
}
