package uk.gegc.schoolwork.features.assignment.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.schoolwork.features.assignment.domain.model.EvaluationType;

@Schema(name = "EvaluationSettingsRequest", description = "How responses to the assignment are graded")
public record EvaluationSettingsRequest(
        @Schema(description = "Evaluation type", example = "VIDEO")
        @NotNull(message = "Evaluation type is required")
        EvaluationType type,

        @Schema(description = "Custom grading prompt")
        String customPrompt,

        @Schema(description = "Free-form grading rules (JSON)")
        JsonNode rules,

        @Schema(description = "Acceptable responses (JSON)")
        JsonNode acceptableResponses,

        @Schema(description = "Feedback settings (JSON object), defaults to {}")
        JsonNode feedbackSettings
) {
}
