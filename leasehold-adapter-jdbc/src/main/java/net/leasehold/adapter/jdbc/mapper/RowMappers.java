package net.leasehold.adapter.jdbc.mapper;

import net.leasehold.adapter.jdbc.JdbcUtil;
import net.leasehold.core.model.JobExecution;
import net.leasehold.core.model.JobLock;
import net.leasehold.core.model.ScheduledJob;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- ScheduledJob ---
    public static ScheduledJob toJob(ResultSet rs) throws SQLException {
        return new ScheduledJob(
                rs.getString("ID"),
                rs.getString("NAME"),
                rs.getString("DESCRIPTION"),
                rs.getString("KIND"),
                rs.getString("SCHEDULE"),
                JsonColumns.read(rs.getString("PARAMETERS"), "PARAMETERS"),
                "Y".equals(rs.getString("ENABLED")),
                rs.getInt("MAX_RETRIES"),
                JdbcUtil.millis(rs, "TIMEOUT_MS"),
                rs.getInt("PRIORITY"),
                JsonColumns.readTags(rs.getString("TAGS")),
                JsonColumns.readMetadata(rs.getString("METADATA")),
                rs.getString("CREATED_BY"),
                JdbcUtil.instant(rs, "NEXT_DUE_AT"),
                JdbcUtil.instant(rs, "CREATED_AT"),
                JdbcUtil.instant(rs, "UPDATED_AT")
        );
    }

    // --- JobExecution ---
    public static JobExecution toExecution(ResultSet rs) throws SQLException {
        return new JobExecution(
                rs.getString("ID"),
                rs.getString("JOB_ID"),
                JobExecution.Status.from(rs.getString("STATUS")),
                JdbcUtil.instant(rs, "STARTED_AT"),
                JdbcUtil.instant(rs, "COMPLETED_AT"),
                JdbcUtil.millis(rs, "DURATION_MS"),
                JsonColumns.read(rs.getString("RESULT"), "RESULT"),
                rs.getString("ERROR"),
                rs.getInt("RETRY_COUNT"),
                rs.getString("INSTANCE_ID"),
                JsonColumns.readMetadata(rs.getString("METADATA"))
        );
    }

    // --- JobLock ---
    public static JobLock toLock(ResultSet rs) throws SQLException {
        return new JobLock(
                rs.getString("ID"),
                rs.getString("JOB_ID"),
                rs.getString("EXECUTION_ID"),
                rs.getString("INSTANCE_ID"),
                JdbcUtil.instant(rs, "LOCKED_AT"),
                JdbcUtil.instant(rs, "LEASE_EXPIRES_AT"),
                JobLock.Status.from(rs.getString("STATUS")),
                JdbcUtil.instant(rs, "RELEASED_AT")
        );
    }
}
