package net.leasehold.adapter.jdbc;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransactionRollbackException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.Calendar;
import java.util.TimeZone;

public final class JdbcUtil {
    private JdbcUtil() {}

    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    // H2: 동시 갱신 충돌
    private static final int H2_CONCURRENT_UPDATE = 90131;

    /**
     * TIMESTAMP 컬럼은 JVM 기본 시간대와 무관하게 UTC 벽시계로 읽고 쓴다.
     * Calendar 는 스레드 안전하지 않으므로 호출마다 새로 만든다.
     */
    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP);
        else ps.setTimestamp(idx, Timestamp.from(i), utc());
    }

    public static Instant instant(ResultSet rs, String col) throws SQLException {
        Timestamp ts = rs.getTimestamp(col, utc());
        return ts == null ? null : ts.toInstant();
    }

    private static Calendar utc() {
        return Calendar.getInstance(UTC);
    }

    public static Duration millis(ResultSet rs, String col) throws SQLException {
        long v = rs.getLong(col);
        return rs.wasNull() ? null : Duration.ofMillis(v);
    }

    public static void setMillis(PreparedStatement ps, int idx, Duration d) throws SQLException {
        if (d == null) ps.setNull(idx, Types.BIGINT);
        else ps.setLong(idx, d.toMillis());
    }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    /** 유니크 위반 / 직렬화 실패 / 동시 갱신 → 경쟁에서 진 것으로 취급 */
    public static boolean isConflict(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException) return true;
        if (e instanceof SQLTransactionRollbackException) return true;
        String state = e.getSQLState();
        if (state != null && (state.startsWith("23") || state.startsWith("40"))) return true;
        return e.getErrorCode() == H2_CONCURRENT_UPDATE;
    }
}
