package uk.gegc.schoolwork.features.assignment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssignmentRepository extends JpaRepository<Assignment, UUID>, JpaSpecificationExecutor<Assignment> {

    @Query("""
            SELECT DISTINCT a FROM Assignment a
            LEFT JOIN FETCH a.questions
            WHERE a.id = :id
            """)
    Optional<Assignment> findByIdWithQuestions(@Param("id") UUID id);

    /**
     * Assignments whose scheduled publish time has passed but which are still inactive.
     */
    @Query("""
            SELECT a FROM Assignment a
            WHERE a.publishedAt IS NOT NULL
              AND a.active = false
              AND a.scheduledPublishAt IS NOT NULL
              AND a.scheduledPublishAt <= :now
            """)
    List<Assignment> findDueForPublishing(@Param("now") Instant now);

    @Query("""
            SELECT DISTINCT m.id FROM Assignment a JOIN a.classes c JOIN c.members m
            WHERE a.id = :assignmentId AND m.role = :role
            """)
    List<UUID> findClassMemberIds(@Param("assignmentId") UUID assignmentId, @Param("role") UserRole role);

    @Query("""
            SELECT DISTINCT s.id FROM Assignment a JOIN a.students s
            WHERE a.id = :assignmentId AND s.role = :role
            """)
    List<UUID> findIndividualStudentIds(@Param("assignmentId") UUID assignmentId, @Param("role") UserRole role);

    @Query("""
            SELECT CASE WHEN COUNT(a) > 0 THEN true ELSE false END FROM Assignment a
            WHERE a.id = :assignmentId
              AND (EXISTS (SELECT 1 FROM Assignment ac JOIN ac.classes c JOIN c.members m
                           WHERE ac.id = a.id AND m.id = :userId)
                OR EXISTS (SELECT 1 FROM Assignment ai JOIN ai.students s
                           WHERE ai.id = a.id AND s.id = :userId))
            """)
    boolean isUserInScope(@Param("assignmentId") UUID assignmentId, @Param("userId") UUID userId);

    @Query("""
            SELECT DISTINCT a.id FROM Assignment a
            LEFT JOIN a.classes c LEFT JOIN c.members m
            LEFT JOIN a.students s
            WHERE a.active = true AND (m.id = :studentId OR s.id = :studentId)
            """)
    List<UUID> findActiveIdsInScopeOfStudent(@Param("studentId") UUID studentId);

    @Query("""
            SELECT DISTINCT a.id FROM Assignment a
            LEFT JOIN a.classes c LEFT JOIN c.members m
            LEFT JOIN a.students s
            WHERE m.id = :userId OR s.id = :userId
            """)
    List<UUID> findIdsInScopeOfUser(@Param("userId") UUID userId);

    @Query("""
            SELECT DISTINCT a.id FROM Assignment a JOIN a.classes c
            WHERE c.id = :classId
            """)
    List<UUID> findIdsByClassId(@Param("classId") UUID classId);

    @Query("""
            SELECT COUNT(DISTINCT a.id) FROM Assignment a JOIN a.classes c
            WHERE c.id = :classId AND a.active = true
            """)
    long countActiveByClassId(@Param("classId") UUID classId);

    long countByTeacher_Id(UUID teacherId);

    long countByTeacher_IdAndActiveTrue(UUID teacherId);

    @Query("""
            SELECT COUNT(a) FROM Assignment a
            WHERE a.teacher.id = :teacherId AND a.active = false
              AND a.scheduledPublishAt IS NOT NULL AND a.scheduledPublishAt > :now
            """)
    long countScheduledByTeacher(@Param("teacherId") UUID teacherId, @Param("now") Instant now);

    long countByActiveTrue();

    @Query("""
            SELECT COUNT(a) FROM Assignment a
            WHERE a.active = false AND a.scheduledPublishAt IS NOT NULL AND a.scheduledPublishAt > :now
            """)
    long countScheduled(@Param("now") Instant now);

    @Query("SELECT DISTINCT a.teacher.id FROM Assignment a WHERE a.teacher IS NOT NULL")
    List<UUID> findDistinctTeacherIds();
}
