package uk.gegc.schoolwork.features.statistics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AssignmentStatsDto", description = "Progress rollup for one assignment")
public record AssignmentStatsDto(
        UUID assignmentId,
        int totalStudents,
        int completedStudents,
        int inProgressStudents,
        int notStartedStudents,
        int totalQuestions,
        int totalAnswers,
        int totalCorrectAnswers,
        @Schema(description = "Percentage of students who completed, two decimals") double completionRate,
        double accuracyRate,
        @Schema(description = "Mean score of completed students") double averageScore,
        Instant lastUpdated
) {
}
