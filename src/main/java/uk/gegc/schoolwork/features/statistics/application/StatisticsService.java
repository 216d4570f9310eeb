package uk.gegc.schoolwork.features.statistics.application;

import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.statistics.api.dto.AssignmentStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.ClassStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.SchoolStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.StudentStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.TeacherStatsDto;
import uk.gegc.schoolwork.features.statistics.domain.model.AssignmentStats;
import uk.gegc.schoolwork.features.statistics.domain.model.ClassStats;
import uk.gegc.schoolwork.features.statistics.domain.model.SchoolStats;
import uk.gegc.schoolwork.features.statistics.domain.model.StudentStats;
import uk.gegc.schoolwork.features.statistics.domain.model.TeacherStats;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Maintains the assignment, student, class, teacher and school rollups.
 */
public interface StatisticsService {

    /**
     * Runs the submission cascade (assignment, student, classes, school) inside the caller's transaction.
     *
     * @param newAnswer         false when the question had already been answered by this student
     * @param previouslyCorrect correctness of the stored answer being replaced; ignored for a new answer
     */
    void recordSubmission(UUID assignmentId, UUID studentId, boolean correct, boolean newAnswer,
                          boolean previouslyCorrect);

    /**
     * Seeds the rollups for a freshly created assignment.
     */
    void initializeAssignmentStatistics(Assignment assignment);

    StudentStats incrementStudentAssignmentCount(UUID studentId);

    ClassStats incrementClassAssignmentCount(UUID classId, boolean active);

    SchoolStats incrementSchoolAssignmentCount(boolean active, boolean scheduled);

    AssignmentStats recalculateAssignment(UUID assignmentId);

    StudentStats recalculateStudent(UUID studentId);

    ClassStats updateClassStatistics(UUID classId);

    TeacherStats updateTeacherStatistics(UUID teacherId);

    SchoolStats updateSchoolStatistics(LocalDate date);

    int pruneSchoolStatistics();

    /**
     * Rebuilds the student and class rollups touched by a scope or activation change.
     */
    void refreshScope(Collection<UUID> studentIds, Collection<UUID> classIds);

    void deleteAssignmentStatistics(UUID assignmentId);

    void deleteStudentStatistics(UUID studentId);

    AssignmentStatsDto getAssignmentStatistics(User currentUser, UUID assignmentId);

    StudentStatsDto getStudentStatistics(User currentUser, UUID studentId);

    ClassStatsDto getClassStatistics(User currentUser, UUID classId);

    TeacherStatsDto getTeacherStatistics(User currentUser, UUID teacherId);

    SchoolStatsDto getSchoolStatistics(User currentUser, LocalDate date);

    List<SchoolStatsDto> getSchoolStatisticsTrend(User currentUser, Integer days);
}
