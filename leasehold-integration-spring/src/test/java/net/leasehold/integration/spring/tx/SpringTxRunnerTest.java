package net.leasehold.integration.spring.tx;

import net.leasehold.adapter.jdbc.TxContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.io.IOException;
import java.sql.Connection;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpringTxRunnerTest {
    private SpringTxRunner tx;

    @BeforeEach
    void setUp() throws Exception {
        DriverManagerDataSource ds = new DriverManagerDataSource(
                "jdbc:h2:mem:tx" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1", "sa", "");
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
        tx.required(() -> {
            TxContext.require().createStatement().execute("CREATE TABLE T_NOTE (TXT VARCHAR(50))");
            return null;
        });
    }

    @Test
    void commits_and_clears_context() throws Exception {
        tx.required(() -> insert("a"));
        assertThat(count()).isEqualTo(1);
        assertThat(TxContext.get()).isNull();
    }

    @Test
    void checked_exception_propagates_unwrapped_and_rolls_back() {
        assertThatThrownBy(() -> tx.required(() -> {
            insert("doomed");
            throw new IOException("disk on fire");
        })).isInstanceOf(IOException.class).hasMessage("disk on fire");

        assertThat(TxContext.get()).isNull();
        assertThatCount(0);
    }

    @Test
    void requires_new_commits_independently_of_outer_rollback() {
        assertThatThrownBy(() -> tx.required(() -> {
            Connection outer = TxContext.require();
            insert("outer");
            tx.requiresNew(() -> insert("inner"));
            assertThat(TxContext.get()).isSameAs(outer);
            throw new IllegalStateException("rollback outer");
        })).isInstanceOf(IllegalStateException.class);

        assertThatCount(1);
    }

    @Test
    void nested_required_joins_outer_connection() throws Exception {
        tx.required(() -> {
            Connection outer = TxContext.require();
            tx.required(() -> {
                assertThat(TxContext.get()).isSameAs(outer);
                return insert("joined");
            });
            return null;
        });
        assertThat(count()).isEqualTo(1);
    }

    private static int insert(String txt) throws Exception {
        try (var ps = TxContext.require().prepareStatement("INSERT INTO T_NOTE (TXT) VALUES (?)")) {
            ps.setString(1, txt);
            return ps.executeUpdate();
        }
    }

    private int count() throws Exception {
        return tx.required(() -> {
            try (var rs = TxContext.require().createStatement().executeQuery("SELECT COUNT(*) FROM T_NOTE")) {
                rs.next();
                return rs.getInt(1);
            }
        });
    }

    private void assertThatCount(int expected) {
        try {
            assertThat(count()).isEqualTo(expected);
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
