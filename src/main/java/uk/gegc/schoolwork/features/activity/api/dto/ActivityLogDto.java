package uk.gegc.schoolwork.features.activity.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLogType;

import java.time.Instant;
import java.util.UUID;

public record ActivityLogDto(
        UUID id,
        ActivityLogType type,
        UUID actorId,
        String actorUsername,
        UUID assignmentId,
        UUID classId,
        JsonNode details,
        Instant createdAt
) {
}
