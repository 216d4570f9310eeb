package uk.gegc.schoolwork.features.assignment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.assignment.domain.model.Question;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface QuestionRepository extends JpaRepository<Question, UUID> {

    long countByAssignment_Id(UUID assignmentId);

    List<Question> findByAssignment_IdOrderByPositionAsc(UUID assignmentId);

    Optional<Question> findByIdAndAssignment_Id(UUID id, UUID assignmentId);

    /**
     * Rows of {@code [assignmentId, questionCount]}.
     */
    @Query("""
            SELECT q.assignment.id, COUNT(q) FROM Question q
            WHERE q.assignment.id IN :assignmentIds
            GROUP BY q.assignment.id
            """)
    List<Object[]> countByAssignmentIds(@Param("assignmentIds") Collection<UUID> assignmentIds);
}
