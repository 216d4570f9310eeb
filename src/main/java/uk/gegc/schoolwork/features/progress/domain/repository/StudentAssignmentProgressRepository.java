package uk.gegc.schoolwork.features.progress.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.progress.domain.model.StudentAssignmentProgress;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StudentAssignmentProgressRepository extends JpaRepository<StudentAssignmentProgress, UUID> {

    Optional<StudentAssignmentProgress> findByStudent_IdAndAssignment_IdAndQuestion_Id(
            UUID studentId, UUID assignmentId, UUID questionId);

    @Query("""
            SELECT p FROM StudentAssignmentProgress p
            JOIN FETCH p.question
            WHERE p.assignment.id = :assignmentId AND p.student.id = :studentId
            ORDER BY p.question.position ASC
            """)
    List<StudentAssignmentProgress> findForStudent(@Param("assignmentId") UUID assignmentId,
                                                   @Param("studentId") UUID studentId);

    @Query("""
            SELECT p FROM StudentAssignmentProgress p
            JOIN FETCH p.student
            JOIN FETCH p.question
            WHERE p.assignment.id = :assignmentId
            """)
    List<StudentAssignmentProgress> findAllForAssignment(@Param("assignmentId") UUID assignmentId);

    @Query("""
            SELECT COUNT(DISTINCT p.question.id) FROM StudentAssignmentProgress p
            WHERE p.student.id = :studentId AND p.assignment.id = :assignmentId AND p.complete = true
            """)
    long countAnsweredQuestions(@Param("studentId") UUID studentId, @Param("assignmentId") UUID assignmentId);

    /**
     * Rows of {@code [studentId, answeredQuestions, correctQuestions]} for one assignment.
     */
    @Query("""
            SELECT p.student.id,
                   COUNT(DISTINCT p.question.id),
                   SUM(CASE WHEN p.correct = true THEN 1 ELSE 0 END)
            FROM StudentAssignmentProgress p
            WHERE p.assignment.id = :assignmentId AND p.complete = true
            GROUP BY p.student.id
            """)
    List<Object[]> tallyByStudent(@Param("assignmentId") UUID assignmentId);

    /**
     * Rows of {@code [assignmentId, answeredQuestions, correctQuestions]} for one student.
     */
    @Query("""
            SELECT p.assignment.id,
                   COUNT(DISTINCT p.question.id),
                   SUM(CASE WHEN p.correct = true THEN 1 ELSE 0 END)
            FROM StudentAssignmentProgress p
            WHERE p.student.id = :studentId AND p.complete = true
            GROUP BY p.assignment.id
            """)
    List<Object[]> tallyByAssignment(@Param("studentId") UUID studentId);

    @Query("""
            SELECT MIN(p.createdAt) FROM StudentAssignmentProgress p
            WHERE p.student.id = :studentId AND p.assignment.id IN :assignmentIds
              AND p.complete = true AND p.correct = false
            """)
    Instant findEarliestIncorrectAnswer(@Param("studentId") UUID studentId,
                                        @Param("assignmentIds") Collection<UUID> assignmentIds);

    @Modifying
    @Query("DELETE FROM StudentAssignmentProgress p WHERE p.assignment.id = :assignmentId")
    int deleteByAssignmentId(@Param("assignmentId") UUID assignmentId);
}
