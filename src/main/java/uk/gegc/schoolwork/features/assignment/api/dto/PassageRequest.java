package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "PassageRequest", description = "A text the student reads or pronounces")
public record PassageRequest(
        @Schema(description = "Passage text", example = "The quick brown fox jumps over the lazy dog.")
        @NotBlank(message = "Passage text is required")
        @Size(max = 10000, message = "Passage text must not exceed 10000 characters")
        String text,

        @Schema(description = "Optional heading shown above the passage")
        @Size(max = 500, message = "Title must not exceed 500 characters")
        String title
) {
}
