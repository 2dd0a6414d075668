package net.leasehold.integration.spring.tx;

import net.leasehold.adapter.jdbc.TxContext;
import net.leasehold.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 TxContext 를 채워 주는 TxRunner.
 * 리포지토리는 스프링을 모르고 TxContext 커넥션만 쓴다.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(required, body, false);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(requiresNew, body, true);
    }

    private <T> T execute(TransactionTemplate tpl, Callable<T> body, boolean fresh) throws Exception {
        try {
            return tpl.execute(status -> {
                Connection outer = TxContext.get();
                // 참여(REQUIRED)면 바깥 커넥션을 그대로 쓴다
                if (outer != null && !fresh) return call(body);

                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
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
        } catch (CheckedFailure f) {
            throw f.cause;
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedFailure(e);
        }
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        TransactionTemplate tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    // 체크 예외를 롤백 대상으로 통과시키고 밖에서 다시 꺼낸다
    private static final class CheckedFailure extends RuntimeException {
        final Exception cause;

        CheckedFailure(Exception cause) {
            super(cause);
            this.cause = cause;
        }
    }
}
