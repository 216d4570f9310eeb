package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FeedbackSettingsRequest", description = "Feedback switches for graded answers")
public record FeedbackSettingsRequest(
        @Schema(description = "Explain each mark", example = "true")
        Boolean detailedFeedback,

        @Schema(description = "Add encouraging remarks", example = "true")
        Boolean encouragementEnabled
) {
}
