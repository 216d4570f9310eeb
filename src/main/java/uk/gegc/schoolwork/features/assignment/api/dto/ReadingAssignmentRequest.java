package uk.gegc.schoolwork.features.assignment.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.schoolwork.features.assignment.domain.model.AssignmentType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "ReadingAssignmentRequest", description = "Reading assignment built around a text")
public record ReadingAssignmentRequest(
        @NotBlank(message = "Topic is required")
        @Size(max = 500, message = "Topic must not exceed 500 characters")
        String topic,

        @Schema(description = "The text students read")
        @NotBlank(message = "Reading text/context is required")
        String context,

        UUID languageId,

        List<UUID> classIds,

        List<UUID> studentIds,

        @NotNull(message = "Assignment type is required")
        AssignmentType type,

        Instant scheduledPublishAt,

        Instant dueDate,

        String color,

        JsonNode vocabularyItems,

        Boolean isIELTS,

        @Schema(description = "Optional grading settings; the type must be READING")
        @Valid
        EvaluationSettingsRequest evaluationSettings
) {
}
