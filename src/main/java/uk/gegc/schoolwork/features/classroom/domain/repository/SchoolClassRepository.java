package uk.gegc.schoolwork.features.classroom.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SchoolClassRepository extends JpaRepository<SchoolClass, UUID> {

    @Query("SELECT c FROM SchoolClass c LEFT JOIN FETCH c.members WHERE c.id = :id")
    Optional<SchoolClass> findByIdWithMembers(@Param("id") UUID id);

    List<SchoolClass> findAllByOrderByNameAsc();

    @Query("""
            SELECT m.id FROM SchoolClass c JOIN c.members m
            WHERE c.id = :classId AND m.role = :role
            """)
    List<UUID> findMemberIdsByRole(@Param("classId") UUID classId, @Param("role") UserRole role);

    @Query("""
            SELECT CASE WHEN COUNT(m) > 0 THEN true ELSE false END
            FROM SchoolClass c JOIN c.members m
            WHERE c.id = :classId AND m.id = :userId
            """)
    boolean isMember(@Param("classId") UUID classId, @Param("userId") UUID userId);

    @Query("SELECT c.id FROM SchoolClass c")
    List<UUID> findAllIds();

    /**
     * Classes linked to the given assignment that the user belongs to.
     */
    @Query("""
            SELECT DISTINCT c.id FROM Assignment a JOIN a.classes c JOIN c.members m
            WHERE a.id = :assignmentId AND m.id = :userId
            """)
    List<UUID> findClassIdsForAssignmentAndMember(@Param("assignmentId") UUID assignmentId,
                                                  @Param("userId") UUID userId);

    @Query("SELECT c.id FROM SchoolClass c JOIN c.members m WHERE m.id = :userId")
    List<UUID> findClassIdsByMember(@Param("userId") UUID userId);

    @Query("""
            SELECT COUNT(DISTINCT m.id) FROM SchoolClass c JOIN c.members m
            WHERE c.id IN :classIds AND m.role = :role
            """)
    long countDistinctMembersByRole(@Param("classIds") Collection<UUID> classIds, @Param("role") UserRole role);
}
