package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "VideoAssignmentRequest", description = "Video comprehension assignment")
public record VideoAssignmentRequest(
        @NotBlank(message = "Topic is required")
        @Size(max = 500, message = "Topic must not exceed 500 characters")
        String topic,

        @Schema(description = "Video link", example = "https://www.youtube.com/watch?v=dQw4w9WgXcQ")
        @NotBlank(message = "Valid video URL is required")
        @URL(message = "Valid video URL is required")
        String videoUrl,

        String videoTranscript,

        @Schema(description = "Language id; blank selects the default English language")
        UUID languageId,

        @NotEmpty(message = "At least one question is required")
        List<@Valid VideoQuestionRequest> questions,

        List<UUID> classIds,

        List<UUID> studentIds,

        @Schema(description = "true links classes, false links individual students")
        @NotNull(message = "assignToEntireClass is required")
        Boolean assignToEntireClass,

        Instant scheduledPublishAt,

        Instant dueDate,

        String color,

        @Schema(description = "Grading rules in plain language")
        List<String> rules,

        @Valid
        FeedbackSettingsRequest feedbackSettings
) {
}
