package uk.gegc.schoolwork.features.activity.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.activity.api.dto.ActivityLogDto;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLog;

@Component
@RequiredArgsConstructor
public class ActivityLogMapper {

    private final ObjectMapper objectMapper;

    public ActivityLogDto toDto(ActivityLog entry, String actorUsername) {
        return new ActivityLogDto(
                entry.getId(),
                entry.getType(),
                entry.getActorId(),
                actorUsername,
                entry.getAssignmentId(),
                entry.getClassId(),
                parseDetails(entry.getDetails()),
                entry.getCreatedAt()
        );
    }

    private JsonNode parseDetails(String details) {
        if (details == null || details.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored activity details are not valid JSON", e);
        }
    }
}
