package com.planforge.jobs.repo;

import com.planforge.jobs.model.JobEntity;
import com.planforge.jobs.model.JobStatus;
import com.planforge.jobs.model.JobType;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface JobRepository extends JpaRepository<JobEntity, UUID> {

    /**
     * Next due pending job of the given types, row-locked for the calling transaction. Rows locked by
     * other claimers are skipped rather than waited on.
     */
    @Query(value = """
            select * from job_queue
             where status = 'PENDING'
               and scheduled_for <= :now
               and job_type in (:types)
             order by priority desc, created_at asc
             limit 1
             for update skip locked
            """, nativeQuery = true)
    Optional<JobEntity> lockNextDue(@Param("types") Collection<String> types, @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from JobEntity j where j.id = :id")
    Optional<JobEntity> findByIdForUpdate(@Param("id") UUID id);

    List<JobEntity> findByPlanIdOrderByCreatedAtDesc(UUID planId);

    Optional<JobEntity> findFirstByPlanIdAndTypeAndStatusInOrderByCreatedAtDesc(UUID planId,
                                                                               JobType type,
                                                                               Collection<JobStatus> statuses);

    long countByUserIdAndTypeAndCreatedAtGreaterThanEqual(UUID userId, JobType type, Instant since);

    List<JobEntity> findByStatusOrderByUpdatedAtDesc(JobStatus status, Pageable pageable);

    @Query("select j.status, count(j) from JobEntity j where j.createdAt >= :since group by j.status")
    List<Object[]> countByStatusSince(@Param("since") Instant since);

    @Query("""
            select j.startedAt, j.completedAt from JobEntity j
             where j.createdAt >= :since
               and j.status = com.planforge.jobs.model.JobStatus.COMPLETED
               and j.startedAt is not null
               and j.completedAt is not null
            """)
    List<Object[]> findProcessingWindowsSince(@Param("since") Instant since);
}
