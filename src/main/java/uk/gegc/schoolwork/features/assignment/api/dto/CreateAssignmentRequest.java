package uk.gegc.schoolwork.features.assignment.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.schoolwork.features.assignment.domain.model.AssignmentType;
import uk.gegc.schoolwork.features.assignment.domain.model.LanguageAssessmentType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "CreateAssignmentRequest", description = "Payload for creating an assignment")
public record CreateAssignmentRequest(
        @Schema(description = "Assignment topic", example = "My family")
        @NotBlank(message = "Topic is required")
        @Size(max = 500, message = "Topic must not exceed 500 characters")
        String topic,

        @Schema(description = "CLASS or INDIVIDUAL", example = "CLASS")
        @NotNull(message = "Assignment type is required")
        AssignmentType type,

        @Schema(description = "Display colour", example = "#3B82F6")
        String color,

        @Schema(description = "Vocabulary items (JSON array)")
        JsonNode vocabularyItems,

        @Schema(description = "Publish time; a future value keeps the assignment inactive until then")
        Instant scheduledPublishAt,

        @Schema(description = "Due date")
        Instant dueDate,

        String videoUrl,

        String videoTranscript,

        LanguageAssessmentType languageAssessmentType,

        Boolean isIELTS,

        @Schema(description = "Reading context")
        String context,

        @Schema(description = "Language id; blank selects the default English language")
        UUID languageId,

        @Schema(description = "Classes the assignment is linked to")
        List<UUID> classIds,

        @Schema(description = "Individually linked students")
        List<UUID> studentIds,

        @Valid
        List<QuestionRequest> questions,

        @Valid
        EvaluationSettingsRequest evaluationSettings
) {
    public CreateAssignmentRequest {
        classIds = classIds == null ? List.of() : classIds;
        studentIds = studentIds == null ? List.of() : studentIds;
        questions = questions == null ? List.of() : questions;
    }
}
