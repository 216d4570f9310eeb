package uk.gegc.schoolwork.features.classroom.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

@Schema(name = "CreateClassRequest", description = "Payload for creating a class")
public record CreateClassRequest(
        @Schema(description = "Class name", example = "Year 7 English")
        @NotBlank(message = "Class name is required")
        @Size(max = 100, message = "Class name must not exceed 100 characters")
        String name,

        @Schema(description = "Initial members (students and teachers)")
        List<UUID> memberIds
) {
    public CreateClassRequest {
        memberIds = memberIds == null ? List.of() : memberIds;
    }
}
