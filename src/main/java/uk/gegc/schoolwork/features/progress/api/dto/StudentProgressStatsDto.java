package uk.gegc.schoolwork.features.progress.api.dto;

public record StudentProgressStatsDto(
        int totalQuestions,
        int completedQuestions,
        int correctAnswers,
        int completionRate,
        int accuracyRate,
        boolean isComplete
) {
}
