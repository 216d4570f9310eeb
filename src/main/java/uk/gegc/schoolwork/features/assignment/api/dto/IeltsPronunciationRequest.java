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

@Schema(name = "IeltsPronunciationRequest", description = "IELTS pronunciation assignment over passages")
public record IeltsPronunciationRequest(
        @NotBlank(message = "Topic is required")
        String topic,

        @Pattern(regexp = "us|uk", message = "accent must be us or uk")
        String accent,

        @NotEmpty(message = "At least one passage is required")
        List<@Valid PassageRequest> passages,

        UUID languageId,

        List<UUID> classIds,

        List<UUID> studentIds,

        @NotNull(message = "assignToEntireClass is required")
        Boolean assignToEntireClass,

        Instant scheduledPublishAt,

        Instant dueDate,

        String color
) {
    public IeltsPronunciationRequest {
        accent = accent == null ? "us" : accent;
    }
}
