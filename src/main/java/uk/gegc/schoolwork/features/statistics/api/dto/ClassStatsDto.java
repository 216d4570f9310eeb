package uk.gegc.schoolwork.features.statistics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ClassStatsDto", description = "Rollup over the student members of a class")
public record ClassStatsDto(
        UUID classId,
        int totalStudents,
        int totalAssignments,
        int activeAssignments,
        double averageCompletion,
        double averageScore,
        long totalAnswers,
        long totalCorrectAnswers,
        double accuracyRate,
        int activeStudents,
        int studentsNeedingHelp,
        Instant lastUpdated
) {
}
