package uk.gegc.schoolwork.features.progress.api.dto;

import java.time.Instant;
import java.util.UUID;

public record QuestionProgressDto(
        UUID questionId,
        String questionText,
        boolean isComplete,
        boolean isCorrect,
        Instant submittedAt
) {
}
