package uk.gegc.schoolwork.features.activity.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLog;

import java.util.UUID;

@Repository
public interface ActivityLogRepository extends JpaRepository<ActivityLog, UUID>, JpaSpecificationExecutor<ActivityLog> {

    @Modifying
    @Query("DELETE FROM ActivityLog l WHERE l.assignmentId = :assignmentId")
    int deleteByAssignmentId(@Param("assignmentId") UUID assignmentId);
}
