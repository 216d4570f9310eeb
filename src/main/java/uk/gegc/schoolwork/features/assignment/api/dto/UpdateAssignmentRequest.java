package uk.gegc.schoolwork.features.assignment.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import uk.gegc.schoolwork.features.assignment.domain.model.LanguageAssessmentType;

import java.time.Instant;
import java.util.UUID;

/**
 * Partial update; null fields are left untouched. {@code clearSchedule} removes the publish time.
 */
@Schema(name = "UpdateAssignmentRequest", description = "Partial update of an assignment")
public record UpdateAssignmentRequest(
        @Size(max = 500, message = "Topic must not exceed 500 characters")
        String topic,

        String color,

        JsonNode vocabularyItems,

        Instant scheduledPublishAt,

        @Schema(description = "Remove the scheduled publish time, publishing immediately")
        Boolean clearSchedule,

        Instant dueDate,

        Boolean isActive,

        String videoUrl,

        String videoTranscript,

        LanguageAssessmentType languageAssessmentType,

        Boolean isIELTS,

        String context,

        UUID languageId
) {
}
