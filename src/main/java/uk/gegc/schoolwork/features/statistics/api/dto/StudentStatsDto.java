package uk.gegc.schoolwork.features.statistics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "StudentStatsDto", description = "Progress rollup for one student")
public record StudentStatsDto(
        UUID studentId,
        int totalAssignments,
        int completedAssignments,
        int inProgressAssignments,
        int notStartedAssignments,
        int totalAnswers,
        int totalCorrectAnswers,
        double completionRate,
        double accuracyRate,
        double averageScore,
        Instant lastActivityDate,
        Instant lastUpdated
) {
}
