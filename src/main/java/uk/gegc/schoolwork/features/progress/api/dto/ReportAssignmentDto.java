package uk.gegc.schoolwork.features.progress.api.dto;

import uk.gegc.schoolwork.features.assignment.api.dto.UserSummaryDto;
import uk.gegc.schoolwork.features.assignment.domain.model.AssignmentType;

import java.util.UUID;

public record ReportAssignmentDto(
        UUID id,
        String topic,
        AssignmentType type,
        int totalQuestions,
        UserSummaryDto teacher
) {
}
