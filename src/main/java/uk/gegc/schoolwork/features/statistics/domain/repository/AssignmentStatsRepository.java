package uk.gegc.schoolwork.features.statistics.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.statistics.domain.model.AssignmentStats;

import java.util.List;
import java.util.UUID;

@Repository
public interface AssignmentStatsRepository extends JpaRepository<AssignmentStats, UUID> {

    /**
     * Single row of {@code [avg(completionRate), avg(averageScore)]} over the teacher's assignments.
     */
    @Query("""
            SELECT AVG(s.completionRate), AVG(s.averageScore) FROM AssignmentStats s
            WHERE s.assignmentId IN (SELECT a.id FROM Assignment a WHERE a.teacher.id = :teacherId)
            """)
    List<Object[]> averagesForTeacher(@Param("teacherId") UUID teacherId);

    @Query("SELECT AVG(s.completionRate), AVG(s.averageScore) FROM AssignmentStats s")
    List<Object[]> averagesForAll();
}
