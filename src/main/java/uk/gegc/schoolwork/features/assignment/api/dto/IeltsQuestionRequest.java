package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@Schema(name = "IeltsQuestionRequest", description = "A speaking prompt of an IELTS Q&A assignment")
public record IeltsQuestionRequest(
        @NotBlank(message = "Question text is required")
        String text,

        String topic,

        @Schema(description = "beginner, intermediate (default) or advanced", example = "intermediate")
        @Pattern(regexp = "beginner|intermediate|advanced", message = "expectedLevel must be beginner, intermediate or advanced")
        String expectedLevel
) {
    public IeltsQuestionRequest {
        expectedLevel = expectedLevel == null ? "intermediate" : expectedLevel;
    }
}
