package uk.gegc.schoolwork.features.progress.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.schoolwork.features.progress.domain.model.SubmissionType;

import java.util.UUID;

@Schema(name = "SubmitProgressRequest", description = "A student's graded answer to one question")
public record SubmitProgressRequest(
        @Schema(description = "Question being answered")
        @NotNull(message = "questionId is required")
        UUID questionId,

        @Schema(description = "Whether the answer was judged correct", example = "true")
        @NotNull(message = "isCorrect is required")
        Boolean isCorrect,

        @Schema(description = "Analysis payload produced by the grader (JSON)")
        @NotNull(message = "result is required")
        JsonNode result,

        @Schema(description = "Kind of submission", example = "VIDEO")
        @NotNull(message = "type is required")
        SubmissionType type
) {
}
