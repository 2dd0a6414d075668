package net.leasehold.core.lock;

import net.leasehold.core.model.LockStats;

import java.time.Duration;
import java.util.Optional;

/**
 * 잡 단위 리스 관리.
 * tryAcquire 의 empty 는 에러가 아니라 Conflict (다른 인스턴스가 보유 중).
 */
public interface LockManager {

    /** 만료된 리스가 있으면 회수 후 획득. 유효한 리스가 있으면 empty */
    Optional<LockToken> tryAcquire(String jobId, String instanceId, Duration lease) throws Exception;

    /** 리스 연장. 이미 만료됐거나 다른 인스턴스가 가져갔으면 empty */
    Optional<LockToken> renew(LockToken token, Duration extendBy) throws Exception;

    /** 보유 중이 아니면 false (이미 해제/만료) */
    boolean release(LockToken token) throws Exception;

    /** ACQUIRED 이지만 리스가 지난 락을 EXPIRED 로 전환 */
    boolean reclaimIfExpired(String jobId) throws Exception;

    LockStats stats() throws Exception;
}
