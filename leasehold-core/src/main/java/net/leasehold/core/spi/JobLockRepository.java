package net.leasehold.core.spi;

import net.leasehold.core.model.JobLock;
import net.leasehold.core.model.LockStats;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobLockRepository {
    /** 소유 잡 행을 FOR UPDATE로 잠근다. 잡이 없으면 false */
    boolean lockJobRow(String jobId) throws Exception;

    Optional<JobLock> findActive(String jobId) throws Exception;

    Optional<JobLock> findById(String lockId) throws Exception;

    /** ACQUIRED 행 삽입. 유니크 제약 위반이면 false */
    boolean insertIfNoneActive(JobLock lock) throws Exception;

    boolean markExpired(String lockId, Instant now) throws Exception;

    boolean release(String lockId, Instant now) throws Exception;

    /** ACQUIRED 이고 아직 유효할 때만 연장 */
    boolean renew(String lockId, Instant now, Instant newExpiry) throws Exception;

    /** LEASE_EXPIRES_AT < now 인 ACQUIRED 락 */
    List<JobLock> findExpired(Instant now) throws Exception;

    /** RELEASED/EXPIRED 중 LOCKED_AT < threshold 삭제 */
    int deleteFinishedOlderThan(Instant threshold) throws Exception;

    LockStats stats() throws Exception;
}
