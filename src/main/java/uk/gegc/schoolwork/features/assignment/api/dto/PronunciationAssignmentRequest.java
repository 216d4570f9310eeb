package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Students are linked individually when {@code studentIds} is non-empty, otherwise the classes are linked.
 */
@Schema(name = "PronunciationAssignmentRequest", description = "Pronunciation practice over one or more passages")
public record PronunciationAssignmentRequest(
        @NotBlank(message = "Topic is required")
        @Size(max = 500, message = "Topic must not exceed 500 characters")
        String topic,

        @Schema(description = "Optional language id")
        UUID languageId,

        List<UUID> classIds,

        List<UUID> studentIds,

        Instant scheduledPublishAt,

        Instant dueDate,

        String color,

        @NotEmpty(message = "At least one question is required")
        List<@Valid PassageRequest> questions
) {
}
