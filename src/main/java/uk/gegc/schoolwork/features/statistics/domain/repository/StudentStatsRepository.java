package uk.gegc.schoolwork.features.statistics.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.statistics.domain.model.StudentStats;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface StudentStatsRepository extends JpaRepository<StudentStats, UUID> {

    /**
     * Single row of {@code [avg(completionRate), avg(averageScore), avg(accuracyRate),
     * sum(totalAnswers), sum(totalCorrectAnswers)]} over the given students.
     */
    @Query("""
            SELECT AVG(s.completionRate), AVG(s.averageScore), AVG(s.accuracyRate),
                   SUM(s.totalAnswers), SUM(s.totalCorrectAnswers)
            FROM StudentStats s
            WHERE s.studentId IN :studentIds
            """)
    List<Object[]> aggregateFor(@Param("studentIds") Collection<UUID> studentIds);

    long countByStudentIdInAndLastActivityDateGreaterThanEqual(Collection<UUID> studentIds, Instant since);

    long countByLastActivityDateGreaterThanEqual(Instant since);

    @Query("""
            SELECT COUNT(s) FROM StudentStats s
            WHERE s.studentId IN :studentIds
              AND (s.completionRate < :completionThreshold OR s.accuracyRate < :accuracyThreshold)
            """)
    long countNeedingHelp(@Param("studentIds") Collection<UUID> studentIds,
                          @Param("completionThreshold") double completionThreshold,
                          @Param("accuracyThreshold") double accuracyThreshold);

    @Query("""
            SELECT COUNT(s) FROM StudentStats s
            WHERE s.completionRate < :completionThreshold OR s.accuracyRate < :accuracyThreshold
            """)
    long countNeedingHelpSchoolWide(@Param("completionThreshold") double completionThreshold,
                                    @Param("accuracyThreshold") double accuracyThreshold);

    /**
     * Single row of {@code [sum(totalAnswers), sum(totalCorrectAnswers)]} across all students.
     */
    @Query("SELECT SUM(s.totalAnswers), SUM(s.totalCorrectAnswers) FROM StudentStats s")
    List<Object[]> answerTotals();
}
