package uk.gegc.schoolwork.features.statistics.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.statistics.domain.model.SchoolStats;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SchoolStatsRepository extends JpaRepository<SchoolStats, UUID> {

    Optional<SchoolStats> findByDate(LocalDate date);

    Optional<SchoolStats> findFirstByOrderByDateDesc();

    List<SchoolStats> findByDateGreaterThanEqualOrderByDateAsc(LocalDate from);

    @Modifying
    @Query("DELETE FROM SchoolStats s WHERE s.date < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDate cutoff);
}
