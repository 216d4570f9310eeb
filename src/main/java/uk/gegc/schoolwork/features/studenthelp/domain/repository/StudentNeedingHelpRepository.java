package uk.gegc.schoolwork.features.studenthelp.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.studenthelp.domain.model.StudentNeedingHelp;

import java.util.List;
import java.util.UUID;

@Repository
public interface StudentNeedingHelpRepository extends JpaRepository<StudentNeedingHelp, UUID> {

    List<StudentNeedingHelp> findByStudent_IdAndResolvedFalseOrderByCreatedAtDesc(UUID studentId);

    @Query("""
            SELECT r FROM StudentNeedingHelp r
            JOIN FETCH r.student
            WHERE r.resolved = false
            ORDER BY r.daysNeedingHelp DESC, r.needsHelpSince ASC
            """)
    List<StudentNeedingHelp> findOpenWithStudent();
}
