package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "VideoQuestionRequest", description = "A comprehension question about the video")
public record VideoQuestionRequest(
        @NotBlank(message = "Question text is required")
        String text,

        @NotBlank(message = "Answer is required")
        String answer
) {
}
