package uk.gegc.schoolwork.features.classroom.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.UUID;

@Schema(name = "ClassMembersRequest", description = "Users to add to or remove from a class")
public record ClassMembersRequest(
        @NotEmpty(message = "At least one user id is required")
        List<UUID> userIds
) {
}
