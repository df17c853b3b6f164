package com.mockprep.sessiontimer.repository;

import com.mockprep.sessiontimer.model.InterviewSession;
import com.mockprep.sessiontimer.store.ActiveSessionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface InterviewSessionRepository extends JpaRepository<InterviewSession, Long> {

    Optional<InterviewSession> findByIdAndUserId(Long id, Long userId);

    @Query("""
            select new com.mockprep.sessiontimer.store.ActiveSessionRecord(
                s.id, s.userId, s.startedAt, s.totalDurationMinutes, s.estimatedDurationMinutes, s.jobTitle, u.credits)
            from InterviewSession s, UserAccount u
            where u.id = s.userId and s.status = 'active' and s.startedAt is not null
            order by s.startedAt asc
            """)
    List<ActiveSessionRecord> findActiveSessionsWithOwnerBalance();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update InterviewSession s
            set s.totalDurationMinutes = :minutes, s.updatedAt = :now
            where s.id = :id and s.status = 'active'
            """)
    int updateDurationIfActive(@Param("id") Long id,
                               @Param("minutes") int minutes,
                               @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update InterviewSession s
            set s.status = 'completed',
                s.endedAt = :now,
                s.updatedAt = :now,
                s.totalDurationMinutes = :minutes,
                s.sessionNotes = concat(coalesce(s.sessionNotes, ''), :note)
            where s.id = :id and s.status = 'active'
            """)
    int completeIfActive(@Param("id") Long id,
                         @Param("minutes") int minutes,
                         @Param("note") String note,
                         @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update InterviewSession s
            set s.status = 'completed',
                s.endedAt = :now,
                s.updatedAt = :now,
                s.totalDurationMinutes = :minutes
            where s.id = :id and s.userId = :userId and s.status = 'active'
            """)
    int finishIfActive(@Param("id") Long id,
                       @Param("userId") Long userId,
                       @Param("minutes") int minutes,
                       @Param("now") Instant now);
}
