package uk.gegc.schoolwork.features.statistics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.time.LocalDate;

@Schema(name = "SchoolStatsDto", description = "School-wide snapshot for one date")
public record SchoolStatsDto(
        LocalDate date,
        long totalUsers,
        long totalTeachers,
        long totalStudents,
        long totalClasses,
        long totalAssignments,
        long activeAssignments,
        long scheduledAssignments,
        double averageCompletionRate,
        double averageScore,
        long totalAnswers,
        long totalCorrectAnswers,
        long dailyActiveStudents,
        long dailyActiveTeachers,
        long studentsNeedingHelp,
        Instant lastUpdated
) {
}
