package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "IeltsReadingRequest", description = "IELTS reading-aloud assignment over passages")
public record IeltsReadingRequest(
        @NotBlank(message = "Topic is required")
        String topic,

        @NotEmpty(message = "At least one passage is required")
        List<@Valid PassageRequest> passages,

        String context,

        @Pattern(regexp = "us|uk", message = "accent must be us or uk")
        String accent,

        UUID languageId,

        List<UUID> classIds,

        List<UUID> studentIds,

        @NotNull(message = "assignToEntireClass is required")
        Boolean assignToEntireClass,

        Instant scheduledPublishAt,

        Instant dueDate,

        String color
) {
    public IeltsReadingRequest {
        accent = accent == null ? "us" : accent;
    }
}
