package uk.gegc.schoolwork.features.statistics.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.statistics.domain.model.ClassStats;

import java.util.UUID;

@Repository
public interface ClassStatsRepository extends JpaRepository<ClassStats, UUID> {
}
