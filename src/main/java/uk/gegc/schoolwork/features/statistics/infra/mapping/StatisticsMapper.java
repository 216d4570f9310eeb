package uk.gegc.schoolwork.features.statistics.infra.mapping;

import org.springframework.stereotype.Component;
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

import java.util.List;

@Component
public class StatisticsMapper {

    public AssignmentStatsDto toDto(AssignmentStats stats) {
        return new AssignmentStatsDto(
                stats.getAssignmentId(),
                stats.getTotalStudents(),
                stats.getCompletedStudents(),
                stats.getInProgressStudents(),
                stats.getNotStartedStudents(),
                stats.getTotalQuestions(),
                stats.getTotalAnswers(),
                stats.getTotalCorrectAnswers(),
                stats.getCompletionRate(),
                stats.getAccuracyRate(),
                stats.getAverageScore(),
                stats.getLastUpdated()
        );
    }

    public StudentStatsDto toDto(StudentStats stats) {
        return new StudentStatsDto(
                stats.getStudentId(),
                stats.getTotalAssignments(),
                stats.getCompletedAssignments(),
                stats.getInProgressAssignments(),
                stats.getNotStartedAssignments(),
                stats.getTotalAnswers(),
                stats.getTotalCorrectAnswers(),
                stats.getCompletionRate(),
                stats.getAccuracyRate(),
                stats.getAverageScore(),
                stats.getLastActivityDate(),
                stats.getLastUpdated()
        );
    }

    public ClassStatsDto toDto(ClassStats stats) {
        return new ClassStatsDto(
                stats.getClassId(),
                stats.getTotalStudents(),
                stats.getTotalAssignments(),
                stats.getActiveAssignments(),
                stats.getAverageCompletion(),
                stats.getAverageScore(),
                stats.getTotalAnswers(),
                stats.getTotalCorrectAnswers(),
                stats.getAccuracyRate(),
                stats.getActiveStudents(),
                stats.getStudentsNeedingHelp(),
                stats.getLastUpdated()
        );
    }

    public TeacherStatsDto toDto(TeacherStats stats) {
        return new TeacherStatsDto(
                stats.getTeacherId(),
                stats.getTotalAssignments(),
                stats.getTotalClasses(),
                stats.getTotalStudents(),
                stats.getAverageClassCompletion(),
                stats.getAverageClassScore(),
                stats.getActiveAssignments(),
                stats.getScheduledAssignments(),
                stats.getLastUpdated()
        );
    }

    public SchoolStatsDto toDto(SchoolStats stats) {
        return new SchoolStatsDto(
                stats.getDate(),
                stats.getTotalUsers(),
                stats.getTotalTeachers(),
                stats.getTotalStudents(),
                stats.getTotalClasses(),
                stats.getTotalAssignments(),
                stats.getActiveAssignments(),
                stats.getScheduledAssignments(),
                stats.getAverageCompletionRate(),
                stats.getAverageScore(),
                stats.getTotalAnswers(),
                stats.getTotalCorrectAnswers(),
                stats.getDailyActiveStudents(),
                stats.getDailyActiveTeachers(),
                stats.getStudentsNeedingHelp(),
                stats.getLastUpdated()
        );
    }

    public List<SchoolStatsDto> toSchoolDtoList(List<SchoolStats> rows) {
        return rows.stream()
                .map(this::toDto)
                .toList();
    }
}
