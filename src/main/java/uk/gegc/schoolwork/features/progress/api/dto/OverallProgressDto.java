package uk.gegc.schoolwork.features.progress.api.dto;

/**
 * Rates are whole percentages.
 */
public record OverallProgressDto(
        int totalStudents,
        int studentsStarted,
        int studentsCompleted,
        int completionRate,
        int averageAccuracy
) {
}
