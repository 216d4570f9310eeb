package uk.gegc.schoolwork.features.statistics.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.statistics.domain.model.TeacherStats;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface TeacherStatsRepository extends JpaRepository<TeacherStats, UUID> {

    long countByLastUpdatedGreaterThanEqual(Instant since);
}
