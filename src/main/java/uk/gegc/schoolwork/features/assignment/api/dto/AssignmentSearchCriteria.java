package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.schoolwork.features.assignment.domain.model.AssignmentType;

import java.util.UUID;

@Schema(name = "AssignmentSearchCriteria", description = "Optional filters for listing assignments")
public record AssignmentSearchCriteria(
        @Schema(description = "CLASS or INDIVIDUAL") AssignmentType type,
        @Schema(description = "Filter by active flag") Boolean isActive,
        @Schema(description = "Owning teacher") UUID teacherId,
        @Schema(description = "Linked class") UUID classId,
        @Schema(description = "Individually linked student") UUID studentId,
        @Schema(description = "Case-insensitive topic search") String search,
        @Schema(description = "Assignment language") UUID languageId,
        @Schema(description = "true: waiting for scheduled publish; false: published or unscheduled") Boolean isScheduled
) {
    public static AssignmentSearchCriteria empty() {
        return new AssignmentSearchCriteria(null, null, null, null, null, null, null, null);
    }
}
