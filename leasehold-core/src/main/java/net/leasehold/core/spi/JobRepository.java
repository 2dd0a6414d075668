package net.leasehold.core.spi;

import net.leasehold.core.model.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface JobRepository {
    Optional<ScheduledJob> findById(String id) throws Exception;

    /** 잡 행을 FOR UPDATE로 잠그고 읽는다 */
    Optional<ScheduledJob> findByIdForUpdate(String id) throws Exception;

    Optional<ScheduledJob> findByName(String name) throws Exception;

    List<ScheduledJob> findAll() throws Exception;

    /**
     * enabled, NEXT_DUE_AT <= now, 살아있는 락 없음.
     * 정렬: PRIORITY DESC, NEXT_DUE_AT ASC, ID ASC
     */
    List<ScheduledJob> findDueCandidates(Instant now, int limit) throws Exception;

    Set<String> findDistinctKinds() throws Exception;

    void insert(ScheduledJob job) throws Exception;

    /** 정의 필드 + NEXT_DUE_AT 갱신 */
    int update(ScheduledJob job) throws Exception;

    /** NEXT_DUE_AT == expected 일 때만 전진 (CAS) */
    boolean advanceCursor(String id, Instant expectedDueAt, Instant nextDueAt, Instant now) throws Exception;

    int setEnabled(String id, boolean enabled, Instant nextDueAt, Instant now) throws Exception;

    int delete(String id) throws Exception;
}
