package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "IeltsQuestionAndAnswerRequest", description = "IELTS speaking assignment with open questions")
public record IeltsQuestionAndAnswerRequest(
        @NotBlank(message = "Topic is required")
        String topic,

        @Schema(description = "us (default) or uk", example = "us")
        @Pattern(regexp = "us|uk", message = "accent must be us or uk")
        String accent,

        @NotEmpty(message = "At least one question is required")
        List<@Valid IeltsQuestionRequest> questions,

        @Schema(description = "Extra instructions, also used as the grading prompt")
        String context,

        UUID languageId,

        List<UUID> classIds,

        List<UUID> studentIds,

        @NotNull(message = "assignToEntireClass is required")
        Boolean assignToEntireClass,

        Instant scheduledPublishAt,

        Instant dueDate,

        String color
) {
    public IeltsQuestionAndAnswerRequest {
        accent = accent == null ? "us" : accent;
    }
}
