package uk.gegc.schoolwork.features.statistics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "TeacherStatsDto", description = "Rollup over a teacher's assignments and classes")
public record TeacherStatsDto(
        UUID teacherId,
        int totalAssignments,
        int totalClasses,
        int totalStudents,
        double averageClassCompletion,
        double averageClassScore,
        int activeAssignments,
        int scheduledAssignments,
        Instant lastUpdated
) {
}
