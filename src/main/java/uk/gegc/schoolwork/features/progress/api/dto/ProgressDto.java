package uk.gegc.schoolwork.features.progress.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.schoolwork.features.progress.domain.model.SubmissionType;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ProgressDto", description = "Stored answer of a student to one question")
public record ProgressDto(
        UUID id,
        UUID studentId,
        UUID assignmentId,
        UUID questionId,
        boolean isComplete,
        boolean isCorrect,
        JsonNode analysisResult,
        JsonNode grammarCorrected,
        SubmissionType submissionType,
        Instant createdAt,
        Instant updatedAt
) {
}
