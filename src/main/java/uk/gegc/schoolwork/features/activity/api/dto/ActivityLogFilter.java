package uk.gegc.schoolwork.features.activity.api.dto;

import uk.gegc.schoolwork.features.activity.domain.model.ActivityLogType;

import java.time.Instant;
import java.util.UUID;

public record ActivityLogFilter(
        UUID actorId,
        ActivityLogType type,
        UUID assignmentId,
        UUID classId,
        Instant from,
        Instant to
) {
}
